package com.mailbridge.service;

import java.util.List;
import java.util.Locale;

/**
 * Archive and compression formats recognized by filename suffix.
 * Declaration order matters: compound suffixes are checked before single ones.
 */
public enum ArchiveFormat {
    TAR_GZ(true, ".tar.gz", ".tgz"),
    TAR_BZ2(true, ".tar.bz2", ".tbz2"),
    TAR_XZ(true, ".tar.xz", ".txz"),
    ZIP(true, ".zip"),
    TAR(true, ".tar"),
    SEVEN_Z(true, ".7z"),
    GZ(true, ".gz"),
    BZ2(true, ".bz2"),
    XZ(true, ".xz"),
    /** Needs an external decoder, always skipped */
    RAR(false, ".rar");

    private final boolean supported;
    private final List<String> suffixes;

    ArchiveFormat(boolean supported, String... suffixes) {
        this.supported = supported;
        this.suffixes = List.of(suffixes);
    }

    public boolean isSupported() {
        return supported;
    }

    /**
     * @return the format for the filename, or null when it is not an archive
     */
    public static ArchiveFormat detect(String filename) {
        if (filename == null) {
            return null;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (ArchiveFormat format : values()) {
            for (String suffix : format.suffixes) {
                if (lower.endsWith(suffix)) {
                    return format;
                }
            }
        }
        return null;
    }

    /**
     * Filename with this format's suffix removed
     */
    public String stripSuffix(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String suffix : suffixes) {
            if (lower.endsWith(suffix)) {
                return filename.substring(0, filename.length() - suffix.length());
            }
        }
        return filename;
    }
}
