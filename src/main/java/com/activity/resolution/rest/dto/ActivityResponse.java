package com.activity.resolution.rest.dto;

import com.activity.resolution.api.ActivitySummary;
import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.time.UtcTimestamps;

/**
 * Response DTO for a canonical activity. Annotation fields are null when none is linked.
 */
public record ActivityResponse(
        long id,
        String startTimeUtc,
        String endTimeUtc,
        Long elapsedTimeS,
        Long movingTimeS,
        Double distanceM,
        String sport,
        String name,
        String timezoneName,
        Integer utcOffsetMinutes,
        String timezoneSource,
        String annotationId,
        String categoryPath,
        Boolean training
) {
    public static ActivityResponse from(ActivitySummary summary) {
        CanonicalActivity a = summary.activity();
        return new ActivityResponse(
                a.getId(),
                UtcTimestamps.format(a.getStartTimeUtc()),
                UtcTimestamps.format(a.getEndTimeUtc()),
                a.getElapsedTimeS(),
                a.getMovingTimeS(),
                a.getDistanceM(),
                a.getSport(),
                a.getName(),
                a.getTimezoneName(),
                a.getUtcOffsetMinutes(),
                a.getTimezoneProvenance() != null ? a.getTimezoneProvenance().getCode() : null,
                summary.annotationNativeId(),
                summary.categoryPath(),
                summary.annotationNativeId() != null ? summary.training() : null
        );
    }

    public static ActivityResponse fromActivity(CanonicalActivity a, String categoryPath) {
        return from(new ActivitySummary(a, null, null, categoryPath, false, null));
    }
}
