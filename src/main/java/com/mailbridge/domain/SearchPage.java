package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of keyword search results.
 * hasMore only says unscanned ids remain, not that any of them match.
 */
@Value
@Builder
public class SearchPage {

    List<MailMessage> messages;

    boolean hasMore;

    /** Cursor to pass as lastId for the next page; null when nothing was scanned */
    String lastId;

    int scanned;

    public static SearchPage empty() {
        return SearchPage.builder().messages(List.of()).hasMore(false).lastId(null).scanned(0).build();
    }
}
