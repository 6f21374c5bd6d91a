package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Decoded message as returned by a store client.
 * Attachments still hold their live MIME part, so instances are projected
 * through {@link MessageView} before they leave the service layer.
 */
@Value
@Builder(toBuilder = true)
public class MailMessage {

    /** Store-assigned id: UID for IMAP, message number for POP3 */
    String id;

    String sender;

    @Builder.Default
    List<String> recipients = List.of();

    @Builder.Default
    List<String> cc = List.of();

    @Builder.Default
    List<String> bcc = List.of();

    String subject;

    String body;

    OffsetDateTime timestamp;

    @Builder.Default
    List<AttachmentRef> attachments = List.of();

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }

    public List<String> attachmentFilenames() {
        return attachments.stream().map(AttachmentRef::getFilename).toList();
    }
}
