package com.activity.resolution.core.model;

import java.util.Optional;

/**
 * The source systems that report workout activities.
 * The code is the value stored in {@code activity_source.source}.
 */
public enum SourceSystem {

    /**
     * GPS/social platform. Native rows carry a JSON payload.
     */
    GPS_PLATFORM("strava"),

    /**
     * Desktop training-log service. Native rows carry local date/time text.
     */
    DESKTOP_LOG("sporttracks");

    private final String code;

    SourceSystem(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Looks up a source system by its stored code (case-insensitive).
     */
    public static Optional<SourceSystem> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (SourceSystem system : values()) {
            if (system.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(system);
            }
        }
        return Optional.empty();
    }
}
