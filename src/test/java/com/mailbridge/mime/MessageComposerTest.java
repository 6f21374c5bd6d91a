package com.mailbridge.mime;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.OutgoingMail;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.util.EmlParser;
import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.Message;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MessageComposer unit tests
 */
class MessageComposerTest {

    @TempDir
    Path tempDir;

    private MailBridgeProperties properties;
    private MessageComposer composer;
    private AccountSettings sender;

    @BeforeEach
    void setUp() {
        properties = new MailBridgeProperties();
        composer = new MessageComposer(properties);
        sender = AccountSettings.builder().address("me@example.com").displayName("Me").build();
    }

    @Test
    @DisplayName("Plain body only produces text/plain")
    void testComposePlain() throws Exception {
        OutgoingMail mail = OutgoingMail.builder().to(List.of("you@example.com")).subject("Hi").body("Hello").build();

        MimeMessage message = composer.compose(EmlParser.getSession(), sender, mail, composer.validate(mail));

        assertThat(message.isMimeType("text/plain")).isTrue();
        assertThat(message.getContent()).isEqualTo("Hello");
        assertThat(message.getSubject()).isEqualTo("Hi");
        assertThat(message.getFrom()[0].toString()).contains("me@example.com");
    }

    @Test
    @DisplayName("HTML body produces multipart/alternative with plain first")
    void testComposeAlternative() throws Exception {
        OutgoingMail mail = OutgoingMail.builder()
                .to(List.of("you@example.com"))
                .subject("Hi")
                .body("Hello")
                .htmlBody("<p>Hello</p>")
                .build();

        MimeMessage message = composer.compose(EmlParser.getSession(), sender, mail, List.of());

        assertThat(message.isMimeType("multipart/alternative")).isTrue();
        MimeMultipart alternative = (MimeMultipart) message.getContent();
        assertThat(alternative.getCount()).isEqualTo(2);
        assertThat(alternative.getBodyPart(0).isMimeType("text/plain")).isTrue();
        assertThat(alternative.getBodyPart(1).isMimeType("text/html")).isTrue();
    }

    @Test
    @DisplayName("Attachments produce multipart/mixed with the body first; Bcc is not a header")
    void testComposeWithAttachment() throws Exception {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "some notes");
        OutgoingMail mail = OutgoingMail.builder()
                .to(List.of("you@example.com"))
                .cc(List.of("cc@example.com"))
                .bcc(List.of("hidden@example.com"))
                .subject("Notes")
                .body("Attached")
                .attachmentPaths(List.of(file.toString()))
                .build();

        MimeMessage message = composer.compose(EmlParser.getSession(), sender, mail, composer.validate(mail));

        assertThat(message.isMimeType("multipart/mixed")).isTrue();
        MimeMultipart mixed = (MimeMultipart) message.getContent();
        assertThat(mixed.getCount()).isEqualTo(2);
        assertThat(mixed.getBodyPart(0).isMimeType("text/plain")).isTrue();
        BodyPart attachment = mixed.getBodyPart(1);
        assertThat(attachment.getFileName()).isEqualTo("notes.txt");

        assertThat(message.getRecipients(Message.RecipientType.BCC)).isNull();
        Address[] envelope = composer.envelopeRecipients(mail);
        assertThat(envelope).extracting(Address::toString)
                .containsExactly("you@example.com", "cc@example.com", "hidden@example.com");
    }

    @Test
    @DisplayName("At least one To address is required")
    void testValidateNoRecipient() {
        OutgoingMail mail = OutgoingMail.builder().subject("x").body("y").build();

        assertThatThrownBy(() -> composer.validate(mail))
                .isInstanceOf(MailBridgeException.class)
                .hasMessageContaining("recipient");
    }

    @Test
    @DisplayName("Missing attachment file aborts before sending")
    void testValidateMissingFile() {
        OutgoingMail mail = OutgoingMail.builder()
                .to(List.of("you@example.com"))
                .attachmentPaths(List.of(tempDir.resolve("absent.pdf").toString()))
                .build();

        assertThatThrownBy(() -> composer.validate(mail))
                .isInstanceOf(MailBridgeException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Directories are not attachable")
    void testValidateDirectory() {
        OutgoingMail mail = OutgoingMail.builder()
                .to(List.of("you@example.com"))
                .attachmentPaths(List.of(tempDir.toString()))
                .build();

        assertThatThrownBy(() -> composer.validate(mail))
                .isInstanceOf(MailBridgeException.class)
                .hasMessageContaining("not a file");
    }

    @Test
    @DisplayName("Attachments above the size ceiling are rejected")
    void testValidateTooLarge() throws Exception {
        properties.getSend().setMaxAttachmentSize(10);
        Path file = Files.write(tempDir.resolve("big.bin"), new byte[20]);
        OutgoingMail mail = OutgoingMail.builder()
                .to(List.of("you@example.com"))
                .attachmentPaths(List.of(file.toString()))
                .build();

        assertThatThrownBy(() -> composer.validate(mail))
                .isInstanceOf(MailBridgeException.class)
                .hasMessageContaining("too large");
    }
}
