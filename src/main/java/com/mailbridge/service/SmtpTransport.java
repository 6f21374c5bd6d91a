package com.mailbridge.service;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.exception.MailBridgeException;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Authenticated SMTP submission through Jakarta Mail
 */
@Slf4j
@Service
public class SmtpTransport implements MailTransport {

    @Override
    public void send(AccountSettings account, MimeMessage message, Address[] recipients) {
        String host = account.getSmtpHost();
        int port = account.getSmtpPort();
        try {
            Transport transport = message.getSession().getTransport("smtp");
            try {
                transport.connect(host, port, account.getAddress(), account.getPassword());
                transport.sendMessage(message, recipients);
                log.info("Mail submitted via {}:{} for {} recipient(s)", host, port, recipients.length);
            } finally {
                transport.close();
            }
        } catch (AuthenticationFailedException e) {
            throw MailBridgeException.connection("SMTP authentication failed for " + account.getAddress()
                    + ": " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw MailBridgeException.connection("SMTP delivery via " + host + ":" + port + " failed: "
                    + e.getMessage(), e);
        }
    }
}
