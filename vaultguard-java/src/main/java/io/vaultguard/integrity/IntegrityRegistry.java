package io.vaultguard.integrity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.vaultguard.crypto.CryptoProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Monitored resource names and their expected SHA-256 hashes.
 *
 * Resource names are paths relative to the monitored root. Hashes are stored as lowercase hex.
 * Readers may call {@link #snapshot()} at any time while the registry is being updated.
 */
public class IntegrityRegistry {

    private static final Logger logger = Logger.getLogger(IntegrityRegistry.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);
    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    public static final int BASELINE_VERSION = 1;

    private final Map<String, String> expectedHashes = new ConcurrentHashMap<>();

    /**
     * Register or replace the expected hash of a resource.
     * @throws IllegalArgumentException if the name escapes the root or the hash is not SHA-256 hex
     */
    public void register(String resourceName, String expectedHash) {
        validateName(resourceName);
        String normalized = expectedHash == null ? null : expectedHash.toLowerCase(Locale.ROOT);
        if (normalized == null || !SHA256_HEX.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Not a SHA-256 hex digest for " + resourceName + ": " + expectedHash);
        }
        expectedHashes.put(resourceName, normalized);
    }

    public boolean unregister(String resourceName) {
        return expectedHashes.remove(resourceName) != null;
    }

    public Optional<String> expectedHash(String resourceName) {
        return Optional.ofNullable(expectedHashes.get(resourceName));
    }

    public boolean isMonitored(String resourceName) {
        return expectedHashes.containsKey(resourceName);
    }

    /**
     * @return Immutable copy of all entries
     */
    public Map<String, String> snapshot() {
        return Map.copyOf(expectedHashes);
    }

    public int size() {
        return expectedHashes.size();
    }

    public void clear() {
        expectedHashes.clear();
    }

    /**
     * Merge entries from a baseline file into the registry. Entries in the file replace existing
     * entries of the same name; other entries are kept.
     * @return Number of entries read
     * @throws IOException if the file cannot be read or parsed
     */
    public int loadBaseline(Path baselineFile) throws IOException {
        Baseline baseline = MAPPER.readValue(baselineFile.toFile(), Baseline.class);
        if (baseline.version() != BASELINE_VERSION) {
            throw new IOException("Unsupported baseline version " + baseline.version() + " in " + baselineFile);
        }
        List<BaselineEntry> resources = baseline.resources() != null ? baseline.resources() : List.of();
        try {
            for (BaselineEntry entry : resources) {
                register(entry.name(), entry.sha256());
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid baseline " + baselineFile + ": " + e.getMessage(), e);
        }
        logger.fine("Loaded " + resources.size() + " expected hashes from " + baselineFile);
        return resources.size();
    }

    /**
     * Write all entries to a baseline file, replacing it atomically.
     */
    public void writeBaseline(Path baselineFile) throws IOException {
        List<BaselineEntry> entries = new ArrayList<>();
        snapshot().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> entries.add(new BaselineEntry(e.getKey(), e.getValue())));

        Path parent = baselineFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = baselineFile.resolveSibling(baselineFile.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), new Baseline(BASELINE_VERSION, entries));
        Files.move(tmp, baselineFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Hash the current contents of resources under root and register them as expected.
     * Resources missing from disk are skipped.
     * @return Number of resources registered
     */
    public int captureBaseline(Path root, CryptoProvider crypto, Collection<String> resourceNames) throws IOException {
        int captured = 0;
        for (String name : resourceNames) {
            validateName(name);
            Path file = root.resolve(name);
            if (!Files.isRegularFile(file)) {
                logger.fine("Skipping missing resource " + name + " while capturing baseline");
                continue;
            }
            try (InputStream in = Files.newInputStream(file)) {
                register(name, crypto.hash(in));
            }
            captured++;
        }
        logger.info("Captured baseline for " + captured + " of " + resourceNames.size() + " resources");
        return captured;
    }

    private static void validateName(String resourceName) {
        if (resourceName == null || resourceName.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
        if (resourceName.contains("..") || resourceName.startsWith("/") || resourceName.startsWith("\\")
                || resourceName.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Resource name must stay under the monitored root: " + resourceName);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Baseline(
        @JsonProperty("version") int version,
        @JsonProperty("resources") List<BaselineEntry> resources
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BaselineEntry(
        @JsonProperty("name") String name,
        @JsonProperty("sha256") String sha256
    ) {}
}
