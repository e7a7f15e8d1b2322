package io.vaultguard.storage;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable key-value store for {@link FileMetadata}.
 * Keys are the derived metadata keys produced by {@link KeyAliasDeriver}.
 */
public interface MetadataStore {

    /**
     * Store or overwrite a record. When this returns, the record is committed.
     * @param key Metadata key
     * @param metadata The record
     * @throws IOException if the record cannot be persisted; the store is left unchanged
     */
    void put(String key, FileMetadata metadata) throws IOException;

    /**
     * Look up a record.
     * @param key Metadata key
     * @return The record, or empty if none is stored
     */
    Optional<FileMetadata> get(String key);

    /**
     * Remove a record.
     * @param key Metadata key
     * @return true if a record was removed, false if there was none
     * @throws IOException if the removal cannot be persisted
     */
    boolean remove(String key) throws IOException;

    default boolean contains(String key) {
        return get(key).isPresent();
    }

    /**
     * @return All stored keys
     */
    List<String> keys();

    default int size() {
        return keys().size();
    }
}
