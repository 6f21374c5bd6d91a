package com.mailbridge.client;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.config.MailProtocol;
import com.mailbridge.domain.OutgoingMail;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.mime.MessageComposer;
import com.mailbridge.service.MailTransport;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * State and outgoing mail handling shared by all client variants
 */
@Slf4j
public abstract class AbstractMailClient implements MailClient {

    protected final AccountSettings account;
    protected final StoreConnector connector;
    private final MessageComposer composer;
    private final MailTransport transport;

    protected ClientState state = ClientState.DISCONNECTED;

    protected AbstractMailClient(AccountSettings account, StoreConnector connector,
                                 MessageComposer composer, MailTransport transport) {
        this.account = account;
        this.connector = connector;
        this.composer = composer;
        this.transport = transport;
    }

    @Override
    public MailProtocol getProtocol() {
        return account.getProtocol();
    }

    @Override
    public ClientState getState() {
        return state;
    }

    @Override
    public void send(OutgoingMail mail) {
        List<Path> attachments = composer.validate(mail);
        try {
            Session session = connector.smtpSession(account);
            MimeMessage message = composer.compose(session, account, mail, attachments);
            transport.send(account, message, composer.envelopeRecipients(mail));
            log.info("Sent message '{}' from {} to {} recipient(s)", mail.getSubject(), account.getAddress(),
                    mail.getTo().size() + mail.getCc().size() + mail.getBcc().size());
        } catch (AddressException e) {
            throw MailBridgeException.validation("Invalid recipient address: " + e.getMessage());
        } catch (MessagingException e) {
            throw new MailBridgeException(ErrorKind.VALIDATION_FAILURE, "Failed to compose message: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MailBridgeException(ErrorKind.ATTACHMENT_FAILURE, "Failed to attach file: " + e.getMessage(), e);
        }
    }

    protected void ensureConnected() {
        if (state == ClientState.DISCONNECTED) {
            connect();
        }
    }
}
