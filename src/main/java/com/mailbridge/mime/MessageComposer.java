package com.mailbridge.mime;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.OutgoingMail;
import com.mailbridge.exception.MailBridgeException;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Builds outgoing MIME messages
 * - body only: text/plain
 * - body + html: multipart/alternative
 * - with attachments: multipart/mixed, body first
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageComposer {

    private final MailBridgeProperties properties;

    /**
     * Check recipients and attachment files before anything is sent.
     * The first violation is reported.
     */
    public List<Path> validate(OutgoingMail mail) {
        if (mail.getTo() == null || mail.getTo().stream().allMatch(a -> a == null || a.isBlank())) {
            throw MailBridgeException.validation("At least one recipient address is required");
        }
        long limit = properties.getSend().getMaxAttachmentSize();
        List<Path> files = new ArrayList<>();
        for (String attachmentPath : mail.getAttachmentPaths()) {
            Path path = Path.of(attachmentPath);
            if (!Files.exists(path)) {
                throw MailBridgeException.validation("Attachment file not found: " + attachmentPath);
            }
            if (!Files.isRegularFile(path)) {
                throw MailBridgeException.validation("Attachment path is not a file: " + attachmentPath);
            }
            if (!Files.isReadable(path)) {
                throw MailBridgeException.validation("Attachment file is not readable: " + attachmentPath);
            }
            long size = size(path);
            if (size > limit) {
                throw MailBridgeException.validation("Attachment file too large: " + attachmentPath
                        + " (" + size + " bytes, limit " + limit + " bytes)");
            }
            files.add(path);
        }
        return files;
    }

    public MimeMessage compose(Session session, AccountSettings sender, OutgoingMail mail,
                               List<Path> attachments) throws MessagingException, IOException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(fromAddress(sender));
        message.setRecipients(Message.RecipientType.TO, parse(mail.getTo()));
        if (!mail.getCc().isEmpty()) {
            message.setRecipients(Message.RecipientType.CC, parse(mail.getCc()));
        }
        message.setSubject(mail.getSubject() == null ? "" : mail.getSubject(), "UTF-8");
        message.setSentDate(new Date());

        boolean hasHtml = mail.getHtmlBody() != null && !mail.getHtmlBody().isBlank();
        String body = mail.getBody() == null ? "" : mail.getBody();

        if (attachments.isEmpty()) {
            if (hasHtml) {
                message.setContent(alternative(body, mail.getHtmlBody()));
            } else {
                message.setText(body, "UTF-8");
            }
        } else {
            MimeMultipart mixed = new MimeMultipart("mixed");
            MimeBodyPart bodyPart = new MimeBodyPart();
            if (hasHtml) {
                bodyPart.setContent(alternative(body, mail.getHtmlBody()));
            } else {
                bodyPart.setText(body, "UTF-8");
            }
            mixed.addBodyPart(bodyPart);

            for (Path file : attachments) {
                MimeBodyPart attachmentPart = new MimeBodyPart();
                attachmentPart.attachFile(file.toFile());
                mixed.addBodyPart(attachmentPart);
                log.debug("Attached {}", file.getFileName());
            }
            message.setContent(mixed);
        }
        message.saveChanges();
        return message;
    }

    /**
     * Envelope recipients: to, cc and bcc combined
     */
    public Address[] envelopeRecipients(OutgoingMail mail) throws MessagingException {
        List<String> all = new ArrayList<>(mail.getTo());
        all.addAll(mail.getCc());
        all.addAll(mail.getBcc());
        return parse(all);
    }

    private static MimeMultipart alternative(String text, String html) throws MessagingException {
        MimeMultipart alternative = new MimeMultipart("alternative");
        MimeBodyPart textPart = new MimeBodyPart();
        textPart.setText(text, "UTF-8");
        alternative.addBodyPart(textPart);
        MimeBodyPart htmlPart = new MimeBodyPart();
        htmlPart.setContent(html, "text/html; charset=UTF-8");
        alternative.addBodyPart(htmlPart);
        return alternative;
    }

    private static InternetAddress fromAddress(AccountSettings sender) throws MessagingException {
        String name = sender.getDisplayName();
        if (name == null || name.isBlank()) {
            return new InternetAddress(sender.getAddress());
        }
        try {
            return new InternetAddress(sender.getAddress(), name, "UTF-8");
        } catch (UnsupportedEncodingException e) {
            throw new MessagingException("Invalid display name: " + name, e);
        }
    }

    private static InternetAddress[] parse(List<String> addresses) throws MessagingException {
        List<String> cleaned = addresses.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(String::trim)
                .toList();
        return InternetAddress.parse(String.join(",", cleaned));
    }

    private static long size(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw MailBridgeException.validation("Attachment file is not readable: " + path + " (" + e.getMessage() + ")");
        }
    }
}
