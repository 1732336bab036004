package com.activity.resolution.rest.dto;

import com.activity.resolution.api.ActivityDetail;
import com.activity.resolution.core.model.SecondaryAnnotation;
import com.activity.resolution.core.model.SourceLink;
import com.activity.resolution.time.UtcTimestamps;

import java.util.List;

/**
 * Response DTO for one activity with its source links and annotations.
 */
public record ActivityDetailResponse(
        ActivityResponse activity,
        List<Source> sources,
        List<Annotation> annotations
) {
    public record Source(String source, String nativeId, String startTimeUtc, String startTimeLocal,
                         Double distanceM, Long durationS, String sport, String matchTier, String ingestedAtUtc) {

        static Source from(SourceLink link) {
            return new Source(link.sourceSystem().getCode(), link.normalizedNativeId(),
                    UtcTimestamps.format(link.startTimeUtc()), link.startTimeLocal(), link.distanceM(),
                    link.durationS(), link.sport(), link.matchTier() != null ? link.matchTier().getCode() : null,
                    UtcTimestamps.format(link.ingestedAt()));
        }
    }

    public record Annotation(String nativeId, Long categoryId, Long workoutTypeId, String notes, String tags,
                             boolean training) {

        static Annotation from(SecondaryAnnotation a) {
            return new Annotation(a.nativeId(), a.categoryId(), a.workoutTypeId(), a.notes(), a.tags(), a.training());
        }
    }

    public static ActivityDetailResponse from(ActivityDetail detail) {
        return new ActivityDetailResponse(
                ActivityResponse.fromActivity(detail.activity(), detail.categoryPath()),
                detail.sources().stream().map(Source::from).toList(),
                detail.annotations().stream().map(Annotation::from).toList());
    }
}
