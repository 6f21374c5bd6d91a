package com.mailbridge.client;

import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.SearchField;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring matching of any keyword against one message field
 */
public final class KeywordMatcher {

    private KeywordMatcher() {}

    public static boolean matches(MailMessage message, List<String> keywords, SearchField field) {
        String haystack = haystack(message, field).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static String haystack(MailMessage message, SearchField field) {
        return switch (field) {
            case SENDER -> nullToEmpty(message.getSender());
            case RECIPIENT -> String.join(" ", message.getRecipients());
            case CC -> String.join(" ", message.getCc());
            case SUBJECT -> nullToEmpty(message.getSubject());
            case CONTENT -> nullToEmpty(message.getBody());
            case ATTACHMENT -> String.join(" ", message.attachmentFilenames());
            case ALL -> {
                List<String> parts = new ArrayList<>();
                parts.add(nullToEmpty(message.getSender()));
                parts.addAll(message.getRecipients());
                parts.addAll(message.getCc());
                parts.add(nullToEmpty(message.getSubject()));
                parts.add(nullToEmpty(message.getBody()));
                parts.addAll(message.attachmentFilenames());
                yield String.join(" ", parts);
            }
        };
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
