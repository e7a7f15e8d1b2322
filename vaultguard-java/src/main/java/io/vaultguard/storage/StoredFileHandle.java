package io.vaultguard.storage;

import java.nio.file.Path;

/**
 * Identity of a ciphertext file on disk.
 *
 * @param name Logical name, without the secure extension
 * @param directory Subdirectory under the storage root, or null for the root itself
 * @param path Physical location of the ciphertext
 */
public record StoredFileHandle(String name, String directory, Path path) {}
