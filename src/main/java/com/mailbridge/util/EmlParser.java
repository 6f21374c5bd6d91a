package com.mailbridge.util;

import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.util.Properties;

/**
 * EML and MIME part utilities based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.decodefilename", "true");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws MessagingException {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        } catch (IOException e) {
            throw new MessagingException("Failed to read EML data", e);
        }
    }

    /**
     * Read the transfer-decoded payload of a part
     */
    public static byte[] readPayload(Part part) throws MessagingException, IOException {
        try (InputStream is = part.getInputStream()) {
            return is.readAllBytes();
        }
    }

    /**
     * Decode RFC 2047 encoded-words; the raw value is kept when decoding fails
     */
    public static String decodeHeader(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        try {
            return MimeUtility.decodeText(MimeUtility.unfold(value)).trim();
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            log.warn("Failed to decode header '{}': {}", value, e.getMessage());
            return value.trim();
        }
    }

    /**
     * Return the mail Session
     */
    public static Session getSession() {
        return SESSION;
    }
}
