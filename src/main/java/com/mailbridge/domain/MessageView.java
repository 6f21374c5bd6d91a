package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Serializable projection of a {@link MailMessage}.
 * Attachments are {@link AttachmentMetadata} until stored, then {@link StoredAttachment}.
 */
@Value
@Builder
public class MessageView {
    String id;
    String sender;
    List<String> recipients;
    List<String> cc;
    List<String> bcc;
    String subject;
    String body;
    String timestamp;
    List<?> attachments;

    public static MessageView of(MailMessage message) {
        return from(message, message.getAttachments().stream().map(AttachmentRef::toMetadata).toList());
    }

    public static MessageView withStored(MailMessage message, List<StoredAttachment> stored) {
        return from(message, stored);
    }

    private static MessageView from(MailMessage message, List<?> attachments) {
        return MessageView.builder()
                .id(message.getId())
                .sender(message.getSender())
                .recipients(message.getRecipients())
                .cc(message.getCc())
                .bcc(message.getBcc())
                .subject(message.getSubject())
                .body(message.getBody())
                .timestamp(message.getTimestamp() == null ? null : message.getTimestamp().toString())
                .attachments(attachments)
                .build();
    }
}
