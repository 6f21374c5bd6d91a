package com.mailbridge.client;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.domain.FetchFilter;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.SearchPage;
import com.mailbridge.domain.SearchRequest;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.mime.MessageComposer;
import com.mailbridge.service.MailTransport;

import java.util.List;

/**
 * Send-only client for accounts configured with the SMTP protocol
 */
public final class SmtpOnlyClient extends AbstractMailClient {

    public SmtpOnlyClient(AccountSettings account, StoreConnector connector,
                          MessageComposer composer, MailTransport transport) {
        super(account, connector, composer, transport);
    }

    @Override
    public void connect() {
        state = ClientState.CONNECTED;
    }

    @Override
    public List<MailMessage> fetch(FetchFilter filter) {
        throw unsupported();
    }

    @Override
    public SearchPage search(SearchRequest request) {
        throw unsupported();
    }

    @Override
    public void disconnect() {
        state = ClientState.DISCONNECTED;
    }

    private MailBridgeException unsupported() {
        return MailBridgeException.validation("Protocol SMTP does not support retrieval");
    }
}
