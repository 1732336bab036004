package com.activity.resolution.api;

import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.core.model.SecondaryAnnotation;

/**
 * A canonical activity joined with its annotation, as listed by range queries.
 * Annotation fields are null when the activity has none.
 */
public record ActivitySummary(
        CanonicalActivity activity,
        String annotationNativeId,
        Long categoryId,
        String categoryPath,
        boolean training,
        String notes
) {
    static ActivitySummary of(CanonicalActivity activity, SecondaryAnnotation annotation, String categoryPath) {
        if (annotation == null) {
            return new ActivitySummary(activity, null, null, categoryPath, false, null);
        }
        return new ActivitySummary(activity, annotation.nativeId(), annotation.categoryId(), categoryPath,
                annotation.training(), annotation.notes());
    }
}
