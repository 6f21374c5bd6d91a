package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Keyword search page request
 */
@Value
@Builder(toBuilder = true)
public class SearchRequest {

    /** Whitespace-separated keywords, matched as a disjunction */
    String keywords;

    @Builder.Default
    SearchField field = SearchField.ALL;

    @Builder.Default
    int pageSize = 5;

    /** Continuation cursor from the previous page */
    String lastId;

    /** Folder to scan, ignored by stores without folders */
    @Builder.Default
    String folder = "INBOX";

    public List<String> keywordList() {
        if (keywords == null || keywords.isBlank()) {
            return List.of();
        }
        return Arrays.stream(keywords.trim().split("\\s+"))
                .filter(k -> !k.isBlank())
                .toList();
    }
}
