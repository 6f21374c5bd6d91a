package com.mailbridge.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Local attachment storage utilities
 * Path structure: basePath/{accountFolder}/{messageId}/{safeFilename}
 */
@Slf4j
public final class StorageUtil {

    public static final String METADATA_FILE = "attachments.json";
    public static final String EXTRACTION_LOG_FILE = "extraction_log.json";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F]");
    private static final int MAX_FILENAME_LENGTH = 255;
    private static final String UNNAMED = "unnamed_file";

    private StorageUtil() {}

    /**
     * Storage-safe filename: unsafe characters become '_', leading/trailing dots and
     * spaces are stripped, length is capped at 255 keeping the extension
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null) {
            return UNNAMED;
        }
        String safe = UNSAFE_CHARS.matcher(filename).replaceAll("_");
        safe = stripDotsAndSpaces(safe);
        if (safe.isEmpty()) {
            return UNNAMED;
        }

        if (safe.length() > MAX_FILENAME_LENGTH) {
            int dot = safe.lastIndexOf('.');
            if (dot > 0) {
                String ext = safe.substring(dot + 1);
                String name = safe.substring(0, dot);
                int maxName = Math.max(1, MAX_FILENAME_LENGTH - ext.length() - 1);
                safe = name.substring(0, Math.min(name.length(), maxName)) + "." + ext;
                if (safe.length() > MAX_FILENAME_LENGTH) {
                    safe = safe.substring(0, MAX_FILENAME_LENGTH);
                }
            } else {
                safe = safe.substring(0, MAX_FILENAME_LENGTH);
            }
        }
        return safe;
    }

    /**
     * Sanitize an archive member path: leading separators are stripped, '.', '..'
     * and empty components are dropped, each remaining component is sanitized.
     *
     * @return relative '/'-joined path, or empty string when nothing usable remains
     */
    public static String sanitizeRelativePath(String memberPath) {
        if (memberPath == null) {
            return "";
        }
        String path = memberPath.replace('\\', '/');
        while (path.startsWith("/")) {
            path = path.substring(1);
        }

        List<String> parts = new ArrayList<>();
        for (String part : path.split("/")) {
            if (part.isBlank() || ".".equals(part) || "..".equals(part)) {
                continue;
            }
            String safePart = sanitizeFilename(part);
            if (!safePart.isEmpty()) {
                parts.add(safePart);
            }
        }
        return String.join("/", parts);
    }

    /**
     * Account folder derived from the address: '@' -> '-', '.' -> '_'
     */
    public static String accountFolder(String address) {
        if (address == null || address.isBlank()) {
            return "unknown";
        }
        String folder = address.trim().replace("@", "-").replace(".", "_");
        return sanitizeFilename(folder);
    }

    /**
     * stem_N.ext form of name; directories in a '/'-separated name are kept
     */
    public static String numberedName(String name, int counter) {
        int slash = name.lastIndexOf('/');
        String parent = slash >= 0 ? name.substring(0, slash + 1) : "";
        String last = slash >= 0 ? name.substring(slash + 1) : name;
        String stem = stem(last);
        return parent + stem + "_" + counter + last.substring(stem.length());
    }

    /**
     * Byte comparison against an existing file; an unreadable file counts as different
     */
    public static boolean sameContent(Path existing, byte[] payload) {
        try {
            return Files.isRegularFile(existing) && Arrays.equals(Files.readAllBytes(existing), payload);
        } catch (IOException e) {
            log.warn("Cannot read existing file {}: {}", existing, e.getMessage());
            return false;
        }
    }

    /**
     * Filename without its last extension; dot-files keep their full name
     */
    public static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static boolean isSidecar(Path file) {
        String name = file.getFileName().toString();
        return METADATA_FILE.equals(name) || EXTRACTION_LOG_FILE.equals(name);
    }

    /**
     * True when candidate resolves strictly inside dir
     */
    public static boolean isInside(Path dir, Path candidate) {
        Path base = dir.toAbsolutePath().normalize();
        Path target = candidate.toAbsolutePath().normalize();
        return target.startsWith(base) && !target.equals(base);
    }

    /**
     * Delete a directory tree
     */
    public static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.delete(path);
            }
        }
        log.debug("Deleted directory tree: {}", dir);
    }

    private static String stripDotsAndSpaces(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == '.' || value.charAt(start) == ' ')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == '.' || value.charAt(end - 1) == ' ')) {
            end--;
        }
        return value.substring(start, end);
    }
}
