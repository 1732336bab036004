package com.activity.resolution.core.model;

import java.util.Objects;

/**
 * User-curated classification of a workout, keyed by a historical native id.
 * The canonical reference is relation-only and may be null.
 */
public record SecondaryAnnotation(
        String nativeId,
        Long categoryId,
        Long workoutTypeId,
        String notes,
        String tags,
        boolean training,
        Long canonicalActivityId
) {
    public SecondaryAnnotation {
        Objects.requireNonNull(nativeId, "nativeId is required");
    }

    public NativeIdRef reference() {
        return NativeIdParser.parse(nativeId);
    }

    public boolean isLinked() {
        return canonicalActivityId != null;
    }
}
