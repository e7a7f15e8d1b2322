package io.vaultguard.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryMetadataStore implements MetadataStore {

    private final Map<String, FileMetadata> records = new ConcurrentHashMap<>();

    @Override
    public void put(String key, FileMetadata metadata) {
        records.put(key, metadata);
    }

    @Override
    public Optional<FileMetadata> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public boolean remove(String key) {
        return records.remove(key) != null;
    }

    @Override
    public List<String> keys() {
        return new ArrayList<>(records.keySet());
    }

    public void clear() {
        records.clear();
    }
}
