package com.mailbridge.client;

import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.SearchPage;
import com.mailbridge.domain.SearchRequest;
import com.mailbridge.exception.MailBridgeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Cursor-based keyword scan over an ordered id list
 * - starts just after lastId when it is in the list, otherwise at the head
 * - scans at most pageSize * scanBudgetFactor messages
 * - the returned cursor is the last scanned id, so no id is scanned twice
 *   across consecutive pages
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchScanner {

    private final MailBridgeProperties properties;

    /**
     * @param orderedIds ids in scan order
     * @param loader     loads and decodes one id; may return null for a vanished message
     */
    public SearchPage scan(List<String> orderedIds, SearchRequest request, Function<String, MailMessage> loader) {
        List<String> keywords = request.keywordList();
        if (keywords.isEmpty() || orderedIds.isEmpty()) {
            return SearchPage.empty();
        }

        int start = 0;
        if (request.getLastId() != null && !request.getLastId().isBlank()) {
            int index = orderedIds.indexOf(request.getLastId().trim());
            if (index >= 0) {
                start = index + 1;
            } else {
                log.debug("Cursor {} not in id list, scanning from the start", request.getLastId());
            }
        }

        int pageSize = request.getPageSize();
        int budget = Math.min(orderedIds.size() - start, pageSize * properties.getSearch().getScanBudgetFactor());

        List<MailMessage> matches = new ArrayList<>();
        String lastScanned = null;
        int scanned = 0;
        for (int i = start; i < start + budget && matches.size() < pageSize; i++) {
            String id = orderedIds.get(i);
            lastScanned = id;
            scanned++;
            try {
                MailMessage message = loader.apply(id);
                if (message != null && KeywordMatcher.matches(message, keywords, request.getField())) {
                    matches.add(message);
                }
            } catch (MailBridgeException e) {
                log.warn("Skipping message {} during search: {}", id, e.getMessage());
            }
        }

        boolean hasMore = start + scanned < orderedIds.size();
        log.info("Search scanned {} of {} messages, {} matches, hasMore={}",
                scanned, orderedIds.size() - start, matches.size(), hasMore);

        return SearchPage.builder()
                .messages(matches)
                .hasMore(hasMore)
                .lastId(lastScanned)
                .scanned(scanned)
                .build();
    }
}
