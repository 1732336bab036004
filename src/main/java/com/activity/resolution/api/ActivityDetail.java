package com.activity.resolution.api;

import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.core.model.SecondaryAnnotation;
import com.activity.resolution.core.model.SourceLink;

import java.util.List;

/**
 * A canonical activity with every source link and annotation referring to it.
 */
public record ActivityDetail(CanonicalActivity activity, List<SourceLink> sources,
                             List<SecondaryAnnotation> annotations, String categoryPath) {

    public ActivityDetail {
        sources = List.copyOf(sources);
        annotations = List.copyOf(annotations);
    }
}
