package com.activity.resolution.time;

import com.activity.resolution.core.exception.ValueParseException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Text form of stored UTC instants. Lexicographic order of the text equals chronological order.
 */
public final class UtcTimestamps {

    private static final DateTimeFormatter STORED_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter LEGACY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

    private UtcTimestamps() {
    }

    public static String format(Instant instant) {
        if (instant == null) {
            return null;
        }
        return STORED_FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Parses a stored UTC timestamp. Accepts the canonical form, ISO instants with
     * fractional seconds, and the {@code yyyy-MM-dd HH:mm:ss} form SQLite date
     * functions produce. Blank input yields null.
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(trimmed, LEGACY_FORMAT).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException legacy) {
                throw new ValueParseException("Unrecognized UTC timestamp", trimmed, legacy);
            }
        }
    }
}
