package io.vaultguard.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Metadata store persisted as a single JSON document.
 *
 * Every mutation rewrites the document to a temporary sibling and atomically moves it over the
 * previous version. The in-memory view only changes once the write has succeeded, so a failed
 * {@code put} or {@code remove} leaves both disk and memory as they were.
 */
public class JsonFileMetadataStore implements MetadataStore {

    private static final Logger logger = Logger.getLogger(JsonFileMetadataStore.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    public static final int VERSION = 1;

    private final Path file;
    private Map<String, FileMetadata> records;

    public JsonFileMetadataStore(Path file) throws IOException {
        this.file = file;
        this.records = load(file);
        logger.fine("Loaded " + records.size() + " metadata records from " + file);
    }

    @Override
    public synchronized void put(String key, FileMetadata metadata) throws IOException {
        Map<String, FileMetadata> updated = new LinkedHashMap<>(records);
        updated.put(key, metadata);
        write(updated);
        records = updated;
    }

    @Override
    public synchronized Optional<FileMetadata> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public synchronized boolean remove(String key) throws IOException {
        if (!records.containsKey(key)) {
            return false;
        }
        Map<String, FileMetadata> updated = new LinkedHashMap<>(records);
        updated.remove(key);
        write(updated);
        records = updated;
        return true;
    }

    @Override
    public synchronized List<String> keys() {
        return new ArrayList<>(records.keySet());
    }

    public Path getFile() {
        return file;
    }

    private void write(Map<String, FileMetadata> snapshot) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(), new Document(VERSION, snapshot));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static Map<String, FileMetadata> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        Document doc = MAPPER.readValue(file.toFile(), Document.class);
        if (doc.version() != VERSION) {
            logger.log(Level.WARNING, "Metadata file " + file + " has version " + doc.version()
                + ", expected " + VERSION);
        }
        return doc.records() != null ? new LinkedHashMap<>(doc.records()) : new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(
        @JsonProperty("version") int version,
        @JsonProperty("records") Map<String, FileMetadata> records
    ) {}
}
