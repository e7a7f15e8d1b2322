package io.vaultguard.crypto;

/**
 * Thrown when encryption, decryption or key management fails.
 * Missing keys, authentication tag mismatches and keystore I/O errors all end up here.
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
