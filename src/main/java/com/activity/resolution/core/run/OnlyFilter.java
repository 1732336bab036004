package com.activity.resolution.core.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Row selection given as {@code key=value[,key=value]}. Repeating a key selects any of its values;
 * different keys must all match.
 *
 * <p>Keys: {@code id} (the unit's own id: native id for ingest, activity id for
 * timezone runs, annotation native id for untangling), {@code canonical}
 * (canonical activity id), {@code sport}, {@code tz_name}, {@code tz_source}.
 */
public final class OnlyFilter {

    public static final String ID = "id";
    public static final String CANONICAL = "canonical";
    public static final String SPORT = "sport";
    public static final String TZ_NAME = "tz_name";
    public static final String TZ_SOURCE = "tz_source";

    private static final Set<String> KEYS = Set.of(ID, CANONICAL, SPORT, TZ_NAME, TZ_SOURCE);
    private static final OnlyFilter NONE = new OnlyFilter(Map.of());

    private final Map<String, Set<String>> values;

    private OnlyFilter(Map<String, Set<String>> values) {
        this.values = values;
    }

    public static OnlyFilter none() {
        return NONE;
    }

    /**
     * Parses a filter expression. A null or blank expression selects everything.
     *
     * @throws IllegalArgumentException on an unknown key or a malformed pair
     */
    public static OnlyFilter parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return NONE;
        }
        Map<String, Set<String>> parsed = new LinkedHashMap<>();
        for (String pair : expression.split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                throw new IllegalArgumentException("Expected key=value in --only, got '" + pair.trim() + "'");
            }
            String key = pair.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = pair.substring(eq + 1).trim();
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown --only key '" + key + "', expected one of " + KEYS);
            }
            parsed.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
        }
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        parsed.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return new OnlyFilter(Collections.unmodifiableMap(frozen));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean constrains(String key) {
        return values.containsKey(key);
    }

    public Set<String> values(String key) {
        return values.getOrDefault(key, Set.of());
    }

    /**
     * Returns true if the key is unconstrained or the value is one of the selected values.
     * Comparison ignores case.
     */
    public boolean accepts(String key, Object value) {
        Set<String> selected = values.get(key);
        if (selected == null) {
            return true;
        }
        if (value == null) {
            return false;
        }
        String text = String.valueOf(value);
        for (String candidate : selected) {
            if (candidate.equalsIgnoreCase(text)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
