package com.climateplatform.collector.fetcher;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Parses the timestamp spellings upstream climate APIs use into UTC instants. */
final class Timestamps {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private Timestamps() {}

    /**
     * Accepts {@code 2024-01-05T12:00:00Z}, {@code 2024-01-05T12:00:00+05:30},
     * {@code 2024-01-05T12:00:00}, {@code 2024-01-05 12:00:00}, {@code 2024-01-05} and
     * {@code 20240105}. Values without an offset are taken as UTC.
     *
     * @throws IllegalArgumentException if none of the forms match
     */
    static Instant parse(String text) {
        String value = text.trim();
        try {
            if (value.length() == 8 && value.chars().allMatch(Character::isDigit)) {
                return LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (value.indexOf(' ') > 0) {
                return LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC);
            }
            if (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(value).toInstant();
            }
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognized timestamp: " + text, e);
        }
    }
}
