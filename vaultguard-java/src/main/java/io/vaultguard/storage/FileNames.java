package io.vaultguard.storage;

import java.util.Optional;

/**
 * Checks for logical names and subdirectory names supplied by callers.
 */
public final class FileNames {

    private FileNames() {}

    /**
     * @param name Candidate logical name or single-level directory name
     * @return Why the name is rejected, or empty if it is acceptable
     */
    public static Optional<String> validate(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of("Name must not be blank");
        }
        if (name.contains("..")) {
            return Optional.of("Name must not contain '..': " + name);
        }
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            return Optional.of("Name must not contain path separators: " + name);
        }
        if (name.indexOf('\0') >= 0) {
            return Optional.of("Name must not contain NUL characters");
        }
        return Optional.empty();
    }

    public static boolean isValid(String name) {
        return validate(name).isEmpty();
    }

    /**
     * Strips the extension from a file name that is known to end with it.
     */
    static String baseName(String fileName, String extension) {
        return fileName.substring(0, fileName.length() - extension.length());
    }
}
