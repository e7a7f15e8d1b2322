package io.vaultguard.storage;

import java.util.Arrays;
import java.util.Objects;

/**
 * Decrypted file contents. Equality compares the bytes, not the array identity.
 */
public record FileData(String fileName, byte[] data) {

    public FileData {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(data, "data");
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileData other)) return false;
        return fileName.equals(other.fileName) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * fileName.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "FileData[fileName=" + fileName + ", size=" + data.length + "]";
    }
}
