package com.mailbridge.client;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.domain.FetchFilter;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.SearchPage;
import com.mailbridge.domain.SearchRequest;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.mime.MessageComposer;
import com.mailbridge.mime.MessageDecoder;
import com.mailbridge.service.MailTransport;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * POP3 client addressing messages by sequence number.
 * POP3 has a single mailbox and no server-side search, so the date range is
 * applied after the limit: filtered-out messages do not free up slots.
 */
@Slf4j
public final class Pop3StoreClient extends AbstractStoreClient {

    private static final String INBOX = "INBOX";

    public Pop3StoreClient(AccountSettings account, StoreConnector connector, MessageDecoder decoder,
                           MessageComposer composer, MailTransport transport, SearchScanner scanner) {
        super(account, connector, decoder, composer, transport, scanner);
    }

    @Override
    public List<MailMessage> fetch(FetchFilter filter) {
        if (!INBOX.equalsIgnoreCase(filter.getFolder())) {
            log.debug("POP3 has no folders, ignoring folder {}", filter.getFolder());
        }
        if (filter.getStartId() != null) {
            log.debug("POP3 does not support startId, ignoring {}", filter.getStartId());
        }
        Folder folder = selectFolder(INBOX);
        try {
            List<String> ids = sequenceNumbers(folder.getMessageCount());
            if (filter.isReverse()) {
                Collections.reverse(ids);
            }
            if (ids.size() > filter.getLimit()) {
                ids = ids.subList(0, filter.getLimit());
            }

            List<MailMessage> messages = new ArrayList<>();
            for (String id : ids) {
                try {
                    MailMessage message = load(folder, id);
                    if (filter.getDateRange() == null || filter.getDateRange().contains(message.getTimestamp())) {
                        messages.add(message);
                    }
                } catch (MailBridgeException e) {
                    log.warn("Skipping message {}: {}", id, e.getMessage());
                }
            }
            log.info("Fetched {} messages over POP3 for {}", messages.size(), account.getAddress());
            return messages;
        } catch (MessagingException e) {
            throw new MailBridgeException(ErrorKind.CONNECTION_FAILURE, "Failed to fetch over POP3: " + e.getMessage(), e);
        }
    }

    @Override
    public SearchPage search(SearchRequest request) {
        if (request.keywordList().isEmpty()) {
            return SearchPage.empty();
        }
        Folder folder = selectFolder(INBOX);
        try {
            List<String> ids = sequenceNumbers(folder.getMessageCount());
            Collections.reverse(ids);
            return scanner.scan(ids, request, id -> load(folder, id));
        } catch (MessagingException e) {
            throw new MailBridgeException(ErrorKind.CONNECTION_FAILURE, "Failed to search over POP3: " + e.getMessage(), e);
        }
    }

    private static List<String> sequenceNumbers(int count) {
        List<String> ids = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            ids.add(String.valueOf(i));
        }
        return ids;
    }

    private MailMessage load(Folder folder, String id) {
        try {
            Message message = folder.getMessage(Integer.parseInt(id));
            return decoder.decode(id, message);
        } catch (MessagingException | IndexOutOfBoundsException e) {
            throw new MailBridgeException(ErrorKind.DECODE_FAILURE, "Failed to load message " + id + ": " + e.getMessage(), e);
        }
    }
}
