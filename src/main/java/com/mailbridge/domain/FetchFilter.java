package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Fetch-by-filter parameters
 */
@Value
@Builder
public class FetchFilter {

    @Builder.Default
    String folder = "INBOX";

    /** Optional date window; null means no date filtering */
    DateRange dateRange;

    @Builder.Default
    int limit = 10;

    /** Resume cursor: fetching starts just after this id */
    String startId;

    /** true for newest first */
    boolean reverse;
}
