package com.activity.resolution.untangle;

import java.util.List;
import java.util.Objects;

/**
 * Decision for one activity: the annotation to keep linked and those to unlink.
 */
public record UntangleRecommendation(long activityId, String keepNativeId, List<String> unlinkNativeIds,
                                     UntangleReason reason) {

    public UntangleRecommendation {
        Objects.requireNonNull(keepNativeId, "keepNativeId is required");
        Objects.requireNonNull(reason, "reason is required");
        unlinkNativeIds = List.copyOf(unlinkNativeIds);
    }
}
