package com.activity.resolution.store;

import com.activity.resolution.time.UtcTimestamps;

import java.time.Instant;
import java.util.Map;

/**
 * Typed access to the loosely typed values SQLite returns.
 */
public final class Rows {

    private Rows() {
    }

    public static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static Long longValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        return (long) Double.parseDouble(text);
    }

    public static Integer intValue(Map<String, Object> row, String column) {
        Long value = longValue(row, column);
        return value == null ? null : value.intValue();
    }

    public static Double doubleValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : Double.parseDouble(text);
    }

    public static Instant instant(Map<String, Object> row, String column) {
        return UtcTimestamps.parse(text(row, column));
    }

    public static boolean flag(Map<String, Object> row, String column) {
        Long value = longValue(row, column);
        return value != null && value == 1L;
    }
}
