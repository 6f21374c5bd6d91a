package com.mailbridge.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Protocol kind an account is reached through
 */
public enum MailProtocol {
    /** Folder-oriented store addressed by UID */
    IMAP,
    /** Sequential numbered store, single mailbox */
    POP3,
    /** Send-only */
    SMTP;

    public boolean supportsRetrieval() {
        return this != SMTP;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MailProtocol from(String value) {
        if (value == null || value.isBlank()) {
            return IMAP;
        }
        try {
            return MailProtocol.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unsupported email protocol: " + value + ". Supported protocols: imap, pop3, smtp", e);
        }
    }
}
