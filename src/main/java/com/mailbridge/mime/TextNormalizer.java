package com.mailbridge.mime;

/**
 * Converts HTML markup to readable plain text.
 * Implementations may throw; the decoder then falls back to {@link TagStripper}.
 */
public interface TextNormalizer {

    String toText(String markup);
}
