package io.vaultguard.crypto;

import java.io.IOException;
import java.io.InputStream;

/**
 * Symmetric encryption keyed by alias, plus secure hashing.
 * Keys are generated on first use of an alias and live only in the provider's key space.
 */
public interface CryptoProvider {

    /**
     * Encrypt data under the key identified by alias, generating the key if needed.
     * @param plaintext Data to encrypt
     * @param alias Key alias
     * @return Ciphertext, self-describing enough for {@link #decrypt}
     * @throws CryptoException if encryption fails
     */
    byte[] encrypt(byte[] plaintext, String alias);

    /**
     * Decrypt data produced by {@link #encrypt} under the same alias.
     * @param ciphertext Data to decrypt
     * @param alias Key alias
     * @return The plaintext
     * @throws CryptoException if the key is missing or the ciphertext fails authentication
     */
    byte[] decrypt(byte[] ciphertext, String alias);

    /**
     * Compute the SHA-256 digest of a stream, reading it in fixed-size chunks.
     * The stream is not closed.
     * @param input Stream to hash
     * @return 64-character lowercase hex digest
     * @throws IOException if reading fails
     */
    String hash(InputStream input) throws IOException;

    /**
     * Remove the key for alias. Removing an unknown alias is a no-op.
     * @param alias Key alias
     * @throws CryptoException if the key space cannot be updated
     */
    void removeKey(String alias);

    boolean hasKey(String alias);
}
