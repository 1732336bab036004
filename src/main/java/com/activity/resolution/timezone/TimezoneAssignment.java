package com.activity.resolution.timezone;

import com.activity.resolution.core.model.TimezoneProvenance;

import java.util.Objects;

/**
 * Result of resolving the timezone of one activity. The offset is null when the zone could not be resolved.
 */
public record TimezoneAssignment(long activityId, String timezoneName, Integer utcOffsetMinutes,
                                 TimezoneProvenance provenance) {

    public TimezoneAssignment {
        Objects.requireNonNull(timezoneName, "timezoneName is required");
        Objects.requireNonNull(provenance, "provenance is required");
    }
}
