package io.vaultguard.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Companion record kept for every stored file.
 *
 * @param fileName Logical name
 * @param mimeType Type guessed from the name's extension
 * @param size Plaintext size in bytes
 * @param lastModified Epoch millis of the last successful save
 * @param tags Caller-supplied labels, in order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileMetadata(
    @JsonProperty("fileName") String fileName,
    @JsonProperty("mimeType") String mimeType,
    @JsonProperty("size") long size,
    @JsonProperty("lastModified") long lastModified,
    @JsonProperty("tags") List<String> tags
) {
    public FileMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public FileMetadata(String fileName, String mimeType, long size, long lastModified) {
        this(fileName, mimeType, size, lastModified, List.of());
    }
}
