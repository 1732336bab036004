package com.activity.resolution.core.model;

/**
 * Why an activity holds its current timezone. Higher ranks are never replaced
 * by lower ranks unless a downgrade is explicitly allowed.
 */
public enum TimezoneProvenance {

    /**
     * Set by an operator, or carrying a tag this engine does not recognize.
     */
    OPERATOR("operator", 50),

    /**
     * Zone label reported by the source platform.
     */
    SOURCE_REPORTED("source-reported", 40),

    /**
     * Zone reported by the source but outside the configured expected zones.
     */
    SOURCE_SUSPECT("source-suspect", 30),

    /**
     * Stationary or virtual session without GPS, pinned to the home zone.
     */
    MANUAL_HOME_NO_GPS("manual-home-no-gps", 20),

    /**
     * No evidence; the home zone was assumed.
     */
    ASSUMED_HOME("assumed-home", 10),

    /**
     * The zone id could not be resolved; the offset was left unset.
     */
    BAD_TIMEZONE_NAME("bad-timezone-name", 0);

    private final String code;
    private final int rank;

    TimezoneProvenance(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    public String getCode() {
        return code;
    }

    public int getRank() {
        return rank;
    }

    public boolean outranks(TimezoneProvenance other) {
        return other == null || rank > other.rank;
    }

    /**
     * Maps a stored tag to a provenance. Null or blank yields null; any other
     * unrecognized tag is treated as {@link #OPERATOR} so it is never silently replaced.
     */
    public static TimezoneProvenance fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (TimezoneProvenance provenance : values()) {
            if (provenance.code.equalsIgnoreCase(code.trim())) {
                return provenance;
            }
        }
        return OPERATOR;
    }
}
