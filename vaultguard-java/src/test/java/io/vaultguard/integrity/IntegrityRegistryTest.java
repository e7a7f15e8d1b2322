package io.vaultguard.integrity;

import io.vaultguard.crypto.KeyStoreCryptoProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IntegrityRegistry")
class IntegrityRegistryTest {

    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    private final IntegrityRegistry registry = new IntegrityRegistry();

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should register and normalize hashes to lowercase")
        void register() {
            registry.register("core.bin", ABC_SHA256.toUpperCase());

            assertTrue(registry.isMonitored("core.bin"));
            assertEquals(ABC_SHA256, registry.expectedHash("core.bin").orElseThrow());
            assertEquals(Map.of("core.bin", ABC_SHA256), registry.snapshot());
        }

        @Test
        @DisplayName("should replace an existing entry")
        void replace() {
            registry.register("core.bin", ABC_SHA256);
            registry.register("core.bin", EMPTY_SHA256);

            assertEquals(1, registry.size());
            assertEquals(EMPTY_SHA256, registry.expectedHash("core.bin").orElseThrow());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "abc", "zz", "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b85"})
        @DisplayName("should reject malformed hashes")
        void malformedHash(String hash) {
            assertThrows(IllegalArgumentException.class, () -> registry.register("core.bin", hash));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "../outside", "/etc/passwd"})
        @DisplayName("should reject names outside the root")
        void badNames(String name) {
            assertThrows(IllegalArgumentException.class, () -> registry.register(name, ABC_SHA256));
        }

        @Test
        @DisplayName("should return a snapshot unaffected by later changes")
        void snapshotIsCopy() {
            registry.register("a", ABC_SHA256);
            Map<String, String> snapshot = registry.snapshot();

            registry.unregister("a");

            assertEquals(1, snapshot.size());
            assertEquals(0, registry.size());
        }
    }

    @Nested
    @DisplayName("Baseline")
    class BaselineTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("should write and load a baseline")
        void writeAndLoad() throws IOException {
            registry.register("core.bin", ABC_SHA256);
            registry.register("config/app.conf", EMPTY_SHA256);
            Path file = dir.resolve("baseline.json");

            registry.writeBaseline(file);
            IntegrityRegistry loaded = new IntegrityRegistry();

            assertEquals(2, loaded.loadBaseline(file));
            assertEquals(registry.snapshot(), loaded.snapshot());
        }

        @Test
        @DisplayName("should read the documented file format")
        void readsFormat() throws IOException {
            Path file = dir.resolve("baseline.json");
            Files.writeString(file, "{\"version\":1,\"resources\":[{\"name\":\"core.bin\",\"sha256\":\"" + ABC_SHA256 + "\"}]}");

            registry.loadBaseline(file);

            assertEquals(ABC_SHA256, registry.expectedHash("core.bin").orElseThrow());
        }

        @Test
        @DisplayName("should reject an unsupported version")
        void unsupportedVersion() throws IOException {
            Path file = dir.resolve("baseline.json");
            Files.writeString(file, "{\"version\":2,\"resources\":[]}");

            assertThrows(IOException.class, () -> registry.loadBaseline(file));
        }

        @Test
        @DisplayName("should reject invalid entries")
        void invalidEntry() throws IOException {
            Path file = dir.resolve("baseline.json");
            Files.writeString(file, "{\"version\":1,\"resources\":[{\"name\":\"core.bin\",\"sha256\":\"nope\"}]}");

            assertThrows(IOException.class, () -> registry.loadBaseline(file));
        }

        @Test
        @DisplayName("should capture hashes of present files")
        void capture() throws IOException {
            Files.writeString(dir.resolve("abc.txt"), "abc");
            Files.createFile(dir.resolve("empty.txt"));

            int captured = registry.captureBaseline(dir, new KeyStoreCryptoProvider(),
                List.of("abc.txt", "empty.txt", "missing.txt"));

            assertEquals(2, captured);
            assertEquals(ABC_SHA256, registry.expectedHash("abc.txt").orElseThrow());
            assertEquals(EMPTY_SHA256, registry.expectedHash("empty.txt").orElseThrow());
            assertFalse(registry.isMonitored("missing.txt"));
        }
    }
}
