package io.vaultguard.storage;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a storage operation: either a value or a {@link StorageError}.
 * Storage operations report every failure through this type instead of throwing.
 */
public final class StorageResult<T> {

    private final T value;
    private final StorageError error;

    private StorageResult(T value, StorageError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> StorageResult<T> success(T value) {
        return new StorageResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> StorageResult<T> failure(StorageError error) {
        return new StorageResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> StorageResult<T> failure(StorageError.Kind kind, String message, Throwable cause) {
        return failure(new StorageError(kind, message, cause));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return The success value
     * @throws IllegalStateException if this is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value: " + error);
        }
        return value;
    }

    /**
     * @return The error
     * @throws IllegalStateException if this is a success
     */
    public StorageError error() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public boolean is(StorageError.Kind kind) {
        return error != null && error.kind() == kind;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <U> StorageResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StorageResult<?> other)) return false;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
