package io.vaultguard.storage;

import java.util.Locale;
import java.util.Map;

/**
 * Extension to MIME type lookup used when recording file metadata.
 */
public final class MimeTypes {

    public static final String DEFAULT = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
        Map.entry("txt", "text/plain"),
        Map.entry("log", "text/plain"),
        Map.entry("csv", "text/csv"),
        Map.entry("html", "text/html"),
        Map.entry("css", "text/css"),
        Map.entry("js", "text/javascript"),
        Map.entry("json", "application/json"),
        Map.entry("xml", "application/xml"),
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("png", "image/png"),
        Map.entry("gif", "image/gif"),
        Map.entry("webp", "image/webp"),
        Map.entry("pdf", "application/pdf"),
        Map.entry("doc", "application/msword"),
        Map.entry("docx", "application/msword"),
        Map.entry("xls", "application/vnd.ms-excel"),
        Map.entry("xlsx", "application/vnd.ms-excel"),
        Map.entry("ppt", "application/vnd.ms-powerpoint"),
        Map.entry("pptx", "application/vnd.ms-powerpoint"),
        Map.entry("zip", "application/zip"),
        Map.entry("mp3", "audio/mpeg"),
        Map.entry("mp4", "video/mp4")
    );

    private MimeTypes() {}

    /**
     * Case-insensitive lookup on the text after the last dot.
     * Names without an extension, or with an unknown one, map to {@link #DEFAULT}.
     */
    public static String guess(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return DEFAULT;
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(ext, DEFAULT);
    }
}
