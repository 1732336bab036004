package com.activity.resolution.core.model;

import java.util.Optional;

/**
 * Confidence with which a source row was attached to its canonical activity.
 * The code is stored in {@code activity_source.match_confidence}.
 */
public enum MatchTier {

    /**
     * Start within 5 minutes and distance or duration within 10%.
     */
    TIER_A("A"),

    /**
     * Start within 15 minutes and distance or duration within 15%.
     */
    TIER_B("B"),

    /**
     * No existing activity qualified; the row created a new canonical activity.
     */
    NEW("new");

    private final String code;

    MatchTier(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isLink() {
        return this != NEW;
    }

    public static Optional<MatchTier> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (MatchTier tier : values()) {
            if (tier.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
