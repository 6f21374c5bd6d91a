package com.mailbridge.client;

import com.mailbridge.config.MailProtocol;
import com.mailbridge.domain.FetchFilter;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.OutgoingMail;
import com.mailbridge.domain.SearchPage;
import com.mailbridge.domain.SearchRequest;

import java.util.List;

/**
 * Protocol session for one account.
 * A client belongs to a single request and is never shared; fetch and search
 * connect implicitly, close() disconnects.
 */
public interface MailClient extends AutoCloseable {

    MailProtocol getProtocol();

    ClientState getState();

    void connect();

    List<MailMessage> fetch(FetchFilter filter);

    SearchPage search(SearchRequest request);

    void send(OutgoingMail mail);

    /**
     * Idempotent, never throws
     */
    void disconnect();

    @Override
    default void close() {
        disconnect();
    }
}
