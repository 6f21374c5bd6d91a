package com.mailbridge.client;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.config.MailProtocol;
import com.mailbridge.exception.MailBridgeException;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Opens Jakarta Mail stores and SMTP sessions for an account
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreConnector {

    private final MailBridgeProperties properties;

    /**
     * Open and authenticate the retrieval store of the account's protocol
     *
     * @throws MailBridgeException CONNECTION_FAILURE on authentication or network errors
     */
    public Store connect(AccountSettings account) {
        MailProtocol protocol = account.getProtocol();
        if (!protocol.supportsRetrieval()) {
            throw MailBridgeException.validation("Protocol " + protocol.name() + " does not support retrieval");
        }
        boolean imap = protocol == MailProtocol.IMAP;
        String host = imap ? account.getImapHost() : account.getPop3Host();
        int port = imap ? account.getImapPort() : account.getPop3Port();
        boolean ssl = imap ? account.isImapSsl() : account.isPop3Ssl();
        String storeProtocol = (imap ? "imap" : "pop3") + (ssl ? "s" : "");

        try {
            Session session = Session.getInstance(storeProperties(storeProtocol, host, port, ssl));
            Store store = session.getStore(storeProtocol);
            store.connect(host, port, account.getAddress(), account.getPassword());
            log.info("Connected to {} server {}:{} as {}", protocol.name(), host, port, account.getAddress());
            return store;
        } catch (AuthenticationFailedException e) {
            throw MailBridgeException.connection("Authentication failed for " + account.getAddress()
                    + " at " + host + ": " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw MailBridgeException.connection("Failed to connect to " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    /**
     * SMTP session with authentication and STARTTLS (or implicit TLS on port 465)
     */
    public Session smtpSession(AccountSettings account) {
        MailBridgeProperties.Mail mail = properties.getMail();
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", account.getSmtpHost());
        props.put("mail.smtp.port", String.valueOf(account.getSmtpPort()));
        props.put("mail.smtp.auth", "true");
        if (account.getSmtpPort() == 465) {
            props.put("mail.smtp.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", String.valueOf(account.isSmtpStarttls()));
        }
        props.put("mail.smtp.connectiontimeout", String.valueOf(mail.getConnectionTimeout()));
        props.put("mail.smtp.timeout", String.valueOf(mail.getTimeout()));
        props.put("mail.mime.charset", "UTF-8");
        props.put("mail.debug", String.valueOf(mail.isDebug()));
        return Session.getInstance(props);
    }

    private Properties storeProperties(String storeProtocol, String host, int port, boolean ssl) {
        MailBridgeProperties.Mail mail = properties.getMail();
        Properties props = new Properties();
        props.put("mail.store.protocol", storeProtocol);
        String prefix = "mail." + storeProtocol + ".";
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "ssl.enable", String.valueOf(ssl));
        props.put(prefix + "connectiontimeout", String.valueOf(mail.getConnectionTimeout()));
        props.put(prefix + "timeout", String.valueOf(mail.getTimeout()));
        props.put("mail.mime.charset", "UTF-8");
        props.put("mail.debug", String.valueOf(mail.isDebug()));
        return props;
    }
}
