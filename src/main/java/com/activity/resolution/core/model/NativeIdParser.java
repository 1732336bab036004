package com.activity.resolution.core.model;

/**
 * Decodes native ids into {@link NativeIdRef} values and encodes source rows
 * back into annotation native ids. This is the only place that knows the
 * prefix convention.
 */
public final class NativeIdParser {

    public static final String GPS_PREFIX = "activity-";
    public static final String DESKTOP_PREFIX = "st-";

    private NativeIdParser() {
    }

    /**
     * Parses an annotation native id.
     */
    public static NativeIdRef parse(String nativeId) {
        if (nativeId == null) {
            return new NativeIdRef(SourceKind.UNKNOWN, null, "");
        }
        String trimmed = nativeId.trim();
        if (trimmed.startsWith(GPS_PREFIX) && trimmed.length() > GPS_PREFIX.length()) {
            return new NativeIdRef(SourceKind.GPS, trimmed.substring(GPS_PREFIX.length()), trimmed);
        }
        if (trimmed.startsWith(DESKTOP_PREFIX) && trimmed.length() > DESKTOP_PREFIX.length()) {
            return new NativeIdRef(SourceKind.DESKTOP, trimmed.substring(DESKTOP_PREFIX.length()), trimmed);
        }
        return new NativeIdRef(SourceKind.UNKNOWN, null, trimmed);
    }

    /**
     * Returns the annotation native id for a source row.
     */
    public static String encode(SourceSystem sourceSystem, String sourceNativeId) {
        return switch (sourceSystem) {
            case GPS_PLATFORM -> GPS_PREFIX + sourceNativeId;
            case DESKTOP_LOG -> DESKTOP_PREFIX + sourceNativeId;
        };
    }

    /**
     * Normalizes a source link native id into the bare id. Some GPS links were
     * historically stored with the annotation prefix.
     */
    public static String normalizeSourceId(SourceSystem sourceSystem, String sourceNativeId) {
        if (sourceNativeId == null) {
            return null;
        }
        String trimmed = sourceNativeId.trim();
        if (sourceSystem == SourceSystem.GPS_PLATFORM && trimmed.startsWith(GPS_PREFIX)) {
            return trimmed.substring(GPS_PREFIX.length());
        }
        return trimmed;
    }
}
