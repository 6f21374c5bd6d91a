package com.mailbridge.util;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Lenient request date parsing
 */
@Slf4j
public final class DateParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy")
    );

    private DateParser() {}

    /**
     * Parse a date or date-time string in one of the supported formats.
     * Values with an explicit offset are converted to the given offset.
     *
     * @return parsed local date-time at the given offset, or null if no format matches
     */
    public static LocalDateTime parse(String value, ZoneOffset offset) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();

        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDateTime parsed = tryParse(trimmed, format, false);
            if (parsed != null) {
                return parsed;
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDateTime parsed = tryParse(trimmed, format, true);
            if (parsed != null) {
                return parsed;
            }
        }
        try {
            return OffsetDateTime.parse(trimmed).withOffsetSameInstant(offset).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.warn("Could not parse datetime: {}", value);
            return null;
        }
    }

    private static LocalDateTime tryParse(String value, DateTimeFormatter format, boolean dateOnly) {
        try {
            return dateOnly ? LocalDate.parse(value, format).atStartOfDay() : LocalDateTime.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
