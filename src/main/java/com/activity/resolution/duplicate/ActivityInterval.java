package com.activity.resolution.duplicate;

import com.activity.resolution.core.model.CanonicalActivity;

import java.time.Instant;
import java.util.Objects;

/**
 * Time interval [start, end) occupied by a canonical activity, with the fields shown in reports.
 */
public record ActivityInterval(long activityId, Instant start, Instant end, String sport,
                               Double distanceM, String name) {

    public ActivityInterval {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start for activity " + activityId);
        }
    }

    static ActivityInterval of(CanonicalActivity activity, Instant end) {
        return new ActivityInterval(activity.getId(), activity.getStartTimeUtc(), end,
                activity.getSport(), activity.getDistanceM(), activity.getName());
    }
}
