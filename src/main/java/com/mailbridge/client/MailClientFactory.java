package com.mailbridge.client;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.mime.MessageComposer;
import com.mailbridge.mime.MessageDecoder;
import com.mailbridge.service.MailTransport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh client per request based on the account protocol
 */
@Component
@RequiredArgsConstructor
public class MailClientFactory {

    private final StoreConnector connector;
    private final MessageDecoder decoder;
    private final MessageComposer composer;
    private final MailTransport transport;
    private final SearchScanner scanner;

    public MailClient create(AccountSettings account) {
        return switch (account.getProtocol()) {
            case IMAP -> new ImapStoreClient(account, connector, decoder, composer, transport, scanner);
            case POP3 -> new Pop3StoreClient(account, connector, decoder, composer, transport, scanner);
            case SMTP -> new SmtpOnlyClient(account, connector, composer, transport);
        };
    }
}
