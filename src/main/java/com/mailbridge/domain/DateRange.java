package com.mailbridge.domain;

import lombok.Value;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Message date window.
 * The start is inclusive; the end date is inclusive as a whole day, so the
 * exclusive upper bound is the start of the day after it.
 */
@Value
public class DateRange {

    LocalDateTime start;
    LocalDateTime end;
    ZoneOffset offset;

    public static DateRange of(LocalDateTime start, LocalDateTime end, ZoneOffset offset) {
        if (start == null && end == null) {
            return null;
        }
        return new DateRange(start, end, offset);
    }

    public OffsetDateTime since() {
        return start == null ? null : start.atOffset(offset);
    }

    /**
     * Exclusive upper bound: the day after the end date, at midnight
     */
    public OffsetDateTime before() {
        return end == null ? null : end.toLocalDate().plusDays(1).atStartOfDay().atOffset(offset);
    }

    public boolean contains(OffsetDateTime timestamp) {
        if (timestamp == null) {
            return false;
        }
        OffsetDateTime since = since();
        if (since != null && timestamp.isBefore(since)) {
            return false;
        }
        OffsetDateTime before = before();
        return before == null || timestamp.isBefore(before);
    }
}
