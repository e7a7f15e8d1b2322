package io.vaultguard.crypto;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyStoreCryptoProvider")
class KeyStoreCryptoProviderTest {

    private KeyStoreCryptoProvider crypto;

    @BeforeEach
    void setUp() {
        crypto = new KeyStoreCryptoProvider();
    }

    @Nested
    @DisplayName("Encryption")
    class EncryptionTests {

        @Test
        @DisplayName("should round trip data under the same alias")
        void roundTrip() {
            byte[] plaintext = "Sensitive payload".getBytes(StandardCharsets.UTF_8);

            byte[] ciphertext = crypto.encrypt(plaintext, "storage_key_a");

            assertFalse(new String(ciphertext, StandardCharsets.ISO_8859_1).contains("Sensitive"));
            assertArrayEquals(plaintext, crypto.decrypt(ciphertext, "storage_key_a"));
        }

        @Test
        @DisplayName("should round trip empty data")
        void emptyData() {
            byte[] ciphertext = crypto.encrypt(new byte[0], "empty");

            assertEquals(12 + 16, ciphertext.length);
            assertEquals(0, crypto.decrypt(ciphertext, "empty").length);
        }

        @Test
        @DisplayName("should use a fresh nonce for each encryption")
        void freshNonce() {
            byte[] plaintext = new byte[64];

            byte[] first = crypto.encrypt(plaintext, "alias");
            byte[] second = crypto.encrypt(plaintext, "alias");

            assertFalse(java.util.Arrays.equals(first, second));
        }

        @Test
        @DisplayName("should generate a key on first use")
        void generatesKey() {
            assertFalse(crypto.hasKey("new-alias"));

            crypto.encrypt(new byte[] {1}, "new-alias");

            assertTrue(crypto.hasKey("new-alias"));
            assertEquals(1, crypto.keyCount());
        }

        @Test
        @DisplayName("should reject ciphertext under another alias")
        void wrongAlias() {
            byte[] ciphertext = crypto.encrypt(new byte[] {1, 2, 3}, "alias-a");
            crypto.encrypt(new byte[] {9}, "alias-b");

            assertThrows(CryptoException.class, () -> crypto.decrypt(ciphertext, "alias-b"));
        }

        @Test
        @DisplayName("should reject tampered ciphertext")
        void tampered() {
            byte[] ciphertext = crypto.encrypt(new byte[] {1, 2, 3, 4}, "alias");
            ciphertext[ciphertext.length - 1] ^= 0x01;

            CryptoException e = assertThrows(CryptoException.class, () -> crypto.decrypt(ciphertext, "alias"));
            assertNotNull(e.getCause());
        }

        @Test
        @DisplayName("should fail when the key is missing")
        void missingKey() {
            byte[] ciphertext = crypto.encrypt(new byte[] {1}, "alias");
            crypto.removeKey("alias");

            assertFalse(crypto.hasKey("alias"));
            assertThrows(CryptoException.class, () -> crypto.decrypt(ciphertext, "alias"));
        }

        @Test
        @DisplayName("should reject truncated ciphertext")
        void truncated() {
            assertThrows(CryptoException.class, () -> crypto.decrypt(new byte[10], "alias"));
        }

        @Test
        @DisplayName("removing an unknown key is a no-op")
        void removeUnknown() {
            assertDoesNotThrow(() -> crypto.removeKey("never-created"));
        }
    }

    @Nested
    @DisplayName("Hashing")
    class HashingTests {

        @Test
        @DisplayName("should produce the SHA-256 of an empty stream")
        void emptyStream() throws IOException {
            assertEquals(
                "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                crypto.hash(new ByteArrayInputStream(new byte[0])));
        }

        @Test
        @DisplayName("should produce the SHA-256 of abc")
        void knownVector() throws IOException {
            assertEquals(
                "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                crypto.hash(new ByteArrayInputStream("abc".getBytes(StandardCharsets.US_ASCII))));
        }

        @Test
        @DisplayName("should hash input larger than one buffer consistently")
        void multiChunk() throws IOException {
            byte[] data = new byte[KeyStoreCryptoProvider.HASH_BUFFER_SIZE * 3 + 17];
            new SecureRandom().nextBytes(data);

            String first = crypto.hash(new ByteArrayInputStream(data));
            String second = crypto.hash(new ByteArrayInputStream(data));

            assertEquals(64, first.length());
            assertEquals(first, second);
            assertEquals(first.toLowerCase(), first);
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should keep keys across provider instances")
        void keysSurviveRestart() {
            Path file = tempDir.resolve("keys.p12");
            char[] password = "changeit".toCharArray();

            KeyStoreCryptoProvider first = new KeyStoreCryptoProvider(file, password);
            byte[] ciphertext = first.encrypt("persisted".getBytes(StandardCharsets.UTF_8), "alias");

            assertTrue(Files.exists(file));

            KeyStoreCryptoProvider second = new KeyStoreCryptoProvider(file, password);
            assertTrue(second.hasKey("alias"));
            assertEquals("persisted", new String(second.decrypt(ciphertext, "alias"), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("should persist key removal")
        void removalPersisted() {
            Path file = tempDir.resolve("keys.p12");
            char[] password = "changeit".toCharArray();

            KeyStoreCryptoProvider first = new KeyStoreCryptoProvider(file, password);
            first.encrypt(new byte[] {1}, "alias");
            first.removeKey("alias");

            assertFalse(new KeyStoreCryptoProvider(file, password).hasKey("alias"));
        }

        @Test
        @DisplayName("should refuse a keystore with the wrong password")
        void wrongPassword() {
            Path file = tempDir.resolve("keys.p12");
            new KeyStoreCryptoProvider(file, "right".toCharArray()).encrypt(new byte[] {1}, "alias");

            assertThrows(CryptoException.class,
                () -> new KeyStoreCryptoProvider(file, "wrong".toCharArray()));
        }
    }
}
