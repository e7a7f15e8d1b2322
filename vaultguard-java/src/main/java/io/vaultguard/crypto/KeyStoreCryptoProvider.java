package io.vaultguard.crypto;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * AES-256-GCM provider whose keys are held in a PKCS#12 {@link KeyStore}.
 *
 * Ciphertext layout is {@code nonce(12) || ciphertext || tag(16)}. The key alias is fed to GCM as
 * associated data, so ciphertext only decrypts under the alias it was written for.
 *
 * When constructed with a keystore file, the key space survives restarts: the file is loaded on
 * construction and rewritten (temp file + atomic move) after every key generation or removal.
 */
public class KeyStoreCryptoProvider implements CryptoProvider {

    private static final Logger logger = Logger.getLogger(KeyStoreCryptoProvider.class.getName());

    public static final int HASH_BUFFER_SIZE = 8192;
    private static final String KEYSTORE_TYPE = "PKCS12";
    private static final String CIPHER_ALGO = "AES/GCM/NoPadding";
    private static final int KEY_SIZE = 256;
    private static final int NONCE_SIZE = 12;
    private static final int GCM_TAG_SIZE = 128; // bits

    private final KeyStore keyStore;
    private final Path keyStoreFile;
    private final char[] password;
    private final SecureRandom random = new SecureRandom();

    /**
     * Creates a provider with a purely in-memory key space, protected by a random password.
     */
    public KeyStoreCryptoProvider() {
        this(null, UUID.randomUUID().toString().toCharArray());
    }

    public KeyStoreCryptoProvider(Path keyStoreFile, char[] password) {
        this.keyStoreFile = keyStoreFile;
        this.password = password.clone();
        try {
            this.keyStore = KeyStore.getInstance(KEYSTORE_TYPE);
            if (keyStoreFile != null && Files.exists(keyStoreFile)) {
                try (InputStream in = Files.newInputStream(keyStoreFile)) {
                    keyStore.load(in, this.password);
                }
                logger.fine("Loaded " + keyStore.size() + " keys from " + keyStoreFile);
            } else {
                keyStore.load(null, this.password);
            }
        } catch (GeneralSecurityException | IOException e) {
            throw new CryptoException("Failed to open keystore: " + keyStoreFile, e);
        }
    }

    @Override
    public byte[] encrypt(byte[] plaintext, String alias) {
        SecretKey key = getOrCreateKey(alias);
        try {
            byte[] nonce = new byte[NONCE_SIZE];
            random.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGO);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_SIZE, nonce));
            cipher.updateAAD(alias.getBytes(StandardCharsets.UTF_8));

            byte[] ciphertext = cipher.doFinal(plaintext);

            ByteBuffer result = ByteBuffer.allocate(NONCE_SIZE + ciphertext.length);
            result.put(nonce);
            result.put(ciphertext);
            return result.array();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Encryption failed for alias " + alias, e);
        }
    }

    @Override
    public byte[] decrypt(byte[] encrypted, String alias) {
        if (encrypted.length < NONCE_SIZE + GCM_TAG_SIZE / 8) {
            throw new CryptoException("Ciphertext too short: " + encrypted.length + " bytes");
        }
        SecretKey key = getKey(alias);
        if (key == null) {
            throw new CryptoException("No key for alias " + alias);
        }
        try {
            byte[] nonce = Arrays.copyOfRange(encrypted, 0, NONCE_SIZE);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGO);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_SIZE, nonce));
            cipher.updateAAD(alias.getBytes(StandardCharsets.UTF_8));

            return cipher.doFinal(encrypted, NONCE_SIZE, encrypted.length - NONCE_SIZE);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Decryption failed for alias " + alias, e);
        }
    }

    @Override
    public String hash(InputStream input) throws IOException {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[HASH_BUFFER_SIZE];
        int read;
        while ((read = input.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public void removeKey(String alias) {
        synchronized (keyStore) {
            try {
                if (!keyStore.containsAlias(alias)) {
                    return;
                }
                keyStore.deleteEntry(alias);
                persist();
                logger.fine("Removed key " + alias);
            } catch (GeneralSecurityException e) {
                throw new CryptoException("Failed to remove key " + alias, e);
            }
        }
    }

    @Override
    public boolean hasKey(String alias) {
        synchronized (keyStore) {
            try {
                return keyStore.containsAlias(alias);
            } catch (GeneralSecurityException e) {
                throw new CryptoException("Keystore not readable", e);
            }
        }
    }

    public int keyCount() {
        synchronized (keyStore) {
            try {
                return keyStore.size();
            } catch (GeneralSecurityException e) {
                throw new CryptoException("Keystore not readable", e);
            }
        }
    }

    private SecretKey getKey(String alias) {
        synchronized (keyStore) {
            try {
                KeyStore.Entry entry = keyStore.getEntry(alias, new KeyStore.PasswordProtection(password));
                if (entry instanceof KeyStore.SecretKeyEntry secretEntry) {
                    return secretEntry.getSecretKey();
                }
                return null;
            } catch (GeneralSecurityException e) {
                throw new CryptoException("Failed to load key " + alias, e);
            }
        }
    }

    private SecretKey getOrCreateKey(String alias) {
        synchronized (keyStore) {
            SecretKey existing = getKey(alias);
            if (existing != null) {
                return existing;
            }
            try {
                KeyGenerator generator = KeyGenerator.getInstance("AES");
                generator.init(KEY_SIZE, random);
                SecretKey key = generator.generateKey();
                keyStore.setEntry(alias, new KeyStore.SecretKeyEntry(key),
                    new KeyStore.PasswordProtection(password));
                persist();
                logger.fine("Generated key " + alias);
                return key;
            } catch (GeneralSecurityException e) {
                throw new CryptoException("Failed to generate key " + alias, e);
            }
        }
    }

    private void persist() {
        if (keyStoreFile == null) {
            return;
        }
        Path tmp = keyStoreFile.resolveSibling(keyStoreFile.getFileName() + ".tmp");
        try {
            Path parent = keyStoreFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(tmp)) {
                keyStore.store(out, password);
            }
            Files.move(tmp, keyStoreFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (GeneralSecurityException | IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                logger.log(Level.WARNING, "Could not remove temporary keystore " + tmp, cleanup);
            }
            throw new CryptoException("Failed to persist keystore " + keyStoreFile, e);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
