package com.mailbridge.client;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.domain.DateRange;
import com.mailbridge.domain.FetchFilter;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.SearchPage;
import com.mailbridge.domain.SearchRequest;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.mime.MessageComposer;
import com.mailbridge.mime.MessageDecoder;
import com.mailbridge.service.MailTransport;
import jakarta.mail.FetchProfile;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.UIDFolder;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.SearchTerm;
import jakarta.mail.search.SentDateTerm;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;

/**
 * IMAP client addressing messages by UID.
 * Date filtering happens on the server, before the limit is applied.
 */
@Slf4j
public final class ImapStoreClient extends AbstractStoreClient {

    public ImapStoreClient(AccountSettings account, StoreConnector connector, MessageDecoder decoder,
                           MessageComposer composer, MailTransport transport, SearchScanner scanner) {
        super(account, connector, decoder, composer, transport, scanner);
    }

    @Override
    public List<MailMessage> fetch(FetchFilter filter) {
        Folder folder = selectFolder(filter.getFolder());
        UIDFolder uidFolder = (UIDFolder) folder;
        try {
            SearchTerm term = dateTerm(filter.getDateRange());
            Message[] matched = term == null ? folder.getMessages() : folder.search(term);
            List<String> ids = uids(folder, uidFolder, matched, Comparator.naturalOrder());
            if (filter.isReverse()) {
                Collections.reverse(ids);
            }
            ids = applyCursor(ids, filter.getStartId());
            if (ids.size() > filter.getLimit()) {
                ids = ids.subList(0, filter.getLimit());
            }

            List<MailMessage> messages = new ArrayList<>();
            for (String id : ids) {
                try {
                    MailMessage message = load(uidFolder, id);
                    if (message != null) {
                        messages.add(message);
                    }
                } catch (MailBridgeException e) {
                    log.warn("Skipping message UID {}: {}", id, e.getMessage());
                }
            }
            log.info("Fetched {} of {} matching messages from {}", messages.size(), matched.length, filter.getFolder());
            return messages;
        } catch (MessagingException e) {
            throw new MailBridgeException(ErrorKind.CONNECTION_FAILURE,
                    "Failed to fetch from " + filter.getFolder() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public SearchPage search(SearchRequest request) {
        if (request.keywordList().isEmpty()) {
            return SearchPage.empty();
        }
        Folder folder = selectFolder(request.getFolder());
        UIDFolder uidFolder = (UIDFolder) folder;
        try {
            List<String> ids = uids(folder, uidFolder, folder.getMessages(), Comparator.reverseOrder());
            return scanner.scan(ids, request, id -> load(uidFolder, id));
        } catch (MessagingException e) {
            throw new MailBridgeException(ErrorKind.CONNECTION_FAILURE,
                    "Failed to search " + request.getFolder() + ": " + e.getMessage(), e);
        }
    }

    /**
     * SENTSINCE start, SENTBEFORE the day after the end date
     */
    static SearchTerm dateTerm(DateRange range) {
        if (range == null) {
            return null;
        }
        List<SearchTerm> terms = new ArrayList<>();
        if (range.since() != null) {
            terms.add(new SentDateTerm(ComparisonTerm.GE, Date.from(range.since().toInstant())));
        }
        if (range.before() != null) {
            terms.add(new SentDateTerm(ComparisonTerm.LT, Date.from(range.before().toInstant())));
        }
        if (terms.isEmpty()) {
            return null;
        }
        return terms.size() == 1 ? terms.get(0) : new AndTerm(terms.toArray(new SearchTerm[0]));
    }

    private List<String> uids(Folder folder, UIDFolder uidFolder, Message[] messages,
                              Comparator<Long> order) throws MessagingException {
        FetchProfile profile = new FetchProfile();
        profile.add(UIDFolder.FetchProfileItem.UID);
        folder.fetch(messages, profile);

        List<Long> uids = new ArrayList<>(messages.length);
        for (Message message : messages) {
            uids.add(uidFolder.getUID(message));
        }
        uids.sort(order);
        return uids.stream().map(String::valueOf).collect(Collectors.toCollection(ArrayList::new));
    }

    private List<String> applyCursor(List<String> ids, String startId) {
        if (startId == null || startId.isBlank()) {
            return ids;
        }
        int index = ids.indexOf(startId.trim());
        if (index < 0) {
            log.warn("startId {} not found in folder, ignoring cursor", startId);
            return ids;
        }
        return new ArrayList<>(ids.subList(index + 1, ids.size()));
    }

    private MailMessage load(UIDFolder uidFolder, String id) {
        try {
            Message message = uidFolder.getMessageByUID(Long.parseLong(id));
            if (message == null) {
                log.debug("UID {} no longer exists", id);
                return null;
            }
            return decoder.decode(id, message);
        } catch (MessagingException e) {
            throw new MailBridgeException(ErrorKind.DECODE_FAILURE, "Failed to load UID " + id + ": " + e.getMessage(), e);
        }
    }
}
