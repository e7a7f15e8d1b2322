package io.vaultguard.storage;

/**
 * Failure side of a {@link StorageResult}.
 *
 * @param kind What went wrong
 * @param message Human-readable description
 * @param cause Underlying exception, or null
 */
public record StorageError(Kind kind, String message, Throwable cause) {

    public enum Kind {
        /** Target file or key absent. */
        NOT_FOUND,
        /** Filesystem or metadata persistence error. */
        IO_FAILURE,
        /** Encryption or decryption error, including a missing key. */
        CRYPTO_FAILURE,
        /** Rejected name or directory, or storage locked down. */
        VALIDATION_FAILURE,
        /** Anything unexpected. */
        INTERNAL_FAILURE
    }

    public StorageError(Kind kind, String message) {
        this(kind, message, null);
    }

    public static StorageError notFound(String message) {
        return new StorageError(Kind.NOT_FOUND, message);
    }

    public static StorageError validation(String message) {
        return new StorageError(Kind.VALIDATION_FAILURE, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message + (cause != null ? " (" + cause + ")" : "");
    }
}
