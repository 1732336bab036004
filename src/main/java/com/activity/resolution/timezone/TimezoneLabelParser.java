package com.activity.resolution.timezone;

import java.util.Optional;

/**
 * Extracts a zone id from a platform timezone label such as
 * {@code "(GMT-06:00) America/Chicago"} or a bare {@code "Europe/Berlin"}.
 */
public final class TimezoneLabelParser {

    private TimezoneLabelParser() {
    }

    public static Optional<String> extractZoneId(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        int close = trimmed.indexOf(')');
        if (close >= 0) {
            String tail = trimmed.substring(close + 1).trim();
            return tail.contains("/") ? Optional.of(tail) : Optional.empty();
        }
        if (trimmed.contains("/") && !trimmed.contains("GMT")) {
            return Optional.of(trimmed);
        }
        return Optional.empty();
    }
}
