package com.mailbridge.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mailbridge.exception.MailBridgeException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Message field a keyword search is scoped to
 */
public enum SearchField {
    SENDER,
    RECIPIENT,
    CC,
    SUBJECT,
    CONTENT,
    ATTACHMENT,
    ALL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SearchField from(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        for (SearchField field : values()) {
            if (field.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return field;
            }
        }
        throw MailBridgeException.validation("Invalid search_type: " + value + ". Expected one of "
                + Arrays.stream(values()).map(SearchField::wireName).collect(Collectors.joining(", ")));
    }
}
