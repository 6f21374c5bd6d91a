package com.mailbridge.mime;

import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.AttachmentRef;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.util.EmlParser;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.ParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Turns a raw Jakarta Mail message into a {@link MailMessage}
 * - headers are RFC 2047 decoded
 * - parts with an attachment disposition become {@link AttachmentRef}s
 * - HTML bodies are converted to text, with the plain part as fallback
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageDecoder {

    /** Converted HTML shorter than this (non-whitespace chars) loses to the plain part */
    static final int MIN_HTML_TEXT_LENGTH = 10;

    private final TextNormalizer textNormalizer;
    private final MailBridgeProperties properties;

    /**
     * Decode one message.
     *
     * @throws MailBridgeException with {@link ErrorKind#DECODE_FAILURE} when the message cannot be parsed
     */
    public MailMessage decode(String id, Message raw) {
        try {
            List<AttachmentRef> attachments = new ArrayList<>();
            StringBuilder plain = new StringBuilder();
            StringBuilder html = new StringBuilder();
            walk(raw, plain, html, attachments);

            return MailMessage.builder()
                    .id(id)
                    .sender(EmlParser.decodeHeader(firstHeader(raw, "From")))
                    .recipients(addresses(raw, "To"))
                    .cc(addresses(raw, "Cc"))
                    .bcc(addresses(raw, "Bcc"))
                    .subject(EmlParser.decodeHeader(firstHeader(raw, "Subject")))
                    .body(selectBody(plain.toString(), html.toString()))
                    .timestamp(timestamp(raw))
                    .attachments(List.copyOf(attachments))
                    .build();
        } catch (MessagingException | IOException e) {
            throw new MailBridgeException(ErrorKind.DECODE_FAILURE,
                    "Failed to decode message " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Pick the body text: converted HTML when it carries enough text, otherwise the plain part
     */
    String selectBody(String plain, String html) {
        if (html.isBlank()) {
            return plain.strip();
        }
        String converted;
        try {
            converted = textNormalizer.toText(html);
        } catch (RuntimeException e) {
            log.warn("HTML normalizer failed, using tag stripper: {}", e.getMessage());
            converted = TagStripper.strip(html);
        }
        if (converted == null) {
            converted = "";
        }
        if (nonWhitespaceLength(converted) < MIN_HTML_TEXT_LENGTH && !plain.isBlank()) {
            return plain.strip();
        }
        return converted.strip();
    }

    private void walk(Part part, StringBuilder plain, StringBuilder html,
                      List<AttachmentRef> attachments) throws MessagingException, IOException {
        if (isAttachment(part)) {
            attachments.add(toAttachmentRef(part, attachments.size() + 1));
            return;
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                walk(multipart.getBodyPart(i), plain, html, attachments);
            }
        } else if (part.isMimeType("text/plain")) {
            plain.append(readText(part));
        } else if (part.isMimeType("text/html")) {
            html.append(readText(part));
        }
    }

    private boolean isAttachment(Part part) throws MessagingException {
        String[] disposition = part.getHeader("Content-Disposition");
        if (disposition == null) {
            return false;
        }
        return Arrays.stream(disposition).anyMatch(d -> d.toLowerCase(Locale.ROOT).contains(Part.ATTACHMENT));
    }

    private AttachmentRef toAttachmentRef(Part part, int index) throws MessagingException {
        String rawName = part.getFileName();
        String filename = rawName == null || rawName.isBlank()
                ? "attachment_" + index
                : EmlParser.decodeHeader(rawName);
        return AttachmentRef.builder()
                .filename(filename)
                .originalFilename(rawName == null ? filename : rawName)
                .contentType(baseType(part.getContentType()))
                .size(part.getSize())
                .part(part)
                .build();
    }

    private String readText(Part part) throws MessagingException, IOException {
        try {
            Object content = part.getContent();
            if (content instanceof String text) {
                return text;
            }
        } catch (UnsupportedEncodingException e) {
            log.warn("Unknown charset in {}, reading as UTF-8", part.getContentType());
        }
        try (InputStream is = part.getInputStream()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private OffsetDateTime timestamp(Message raw) throws MessagingException {
        ZoneOffset offset = properties.getZoneOffset();
        Date sent = raw.getSentDate();
        if (sent == null) {
            return OffsetDateTime.now(offset);
        }
        return sent.toInstant().atOffset(offset);
    }

    private static List<String> addresses(Message raw, String header) throws MessagingException {
        String value = firstHeader(raw, header) == null ? null : String.join(",", raw.getHeader(header));
        String decoded = EmlParser.decodeHeader(value);
        if (decoded.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(decoded.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String firstHeader(Message raw, String header) throws MessagingException {
        String[] values = raw.getHeader(header);
        return values == null || values.length == 0 ? null : values[0];
    }

    private static String baseType(String contentType) {
        if (contentType == null) {
            return "application/octet-stream";
        }
        try {
            return new ContentType(contentType).getBaseType().toLowerCase();
        } catch (ParseException e) {
            log.debug("Unparsable content type '{}'", contentType);
            return "application/octet-stream";
        }
    }

    private static int nonWhitespaceLength(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
