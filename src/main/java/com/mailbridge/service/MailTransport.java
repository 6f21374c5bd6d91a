package com.mailbridge.service;

import com.mailbridge.config.AccountSettings;
import jakarta.mail.Address;
import jakarta.mail.internet.MimeMessage;

/**
 * Hands a composed message to the account's submission server
 */
public interface MailTransport {

    /**
     * @throws com.mailbridge.exception.MailBridgeException CONNECTION_FAILURE when the server rejects
     *                                                      the login or cannot be reached
     */
    void send(AccountSettings account, MimeMessage message, Address[] recipients);
}
