package com.mailbridge.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DownloadStatus {
    SUCCESS,
    SKIPPED_EXISTING,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DownloadStatus from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Both stored and already-present count as available on disk */
    public boolean isAvailable() {
        return this != FAILED;
    }
}
