package com.activity.resolution.api;

import com.activity.resolution.category.CategoryPathCache;
import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.core.model.NativeIdParser;
import com.activity.resolution.core.model.SecondaryAnnotation;
import com.activity.resolution.core.model.SourceLink;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.AnnotationRepository;
import com.activity.resolution.store.SourceLinkRepository;
import com.activity.resolution.store.StoreConnection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups over canonical activities for front ends.
 */
public class ActivityQueryService {

    private final ActivityRepository activities;
    private final SourceLinkRepository sourceLinks;
    private final AnnotationRepository annotations;
    private final CategoryPathCache categoryPaths;

    public ActivityQueryService(StoreConnection store, CategoryPathCache categoryPaths) {
        this.activities = new ActivityRepository(store);
        this.sourceLinks = new SourceLinkRepository(store);
        this.annotations = new AnnotationRepository(store);
        this.categoryPaths = categoryPaths;
    }

    /**
     * Activities starting in [from, to), ordered by start then id.
     */
    public Page<ActivitySummary> findInRange(Instant from, Instant to, PageRequest request) {
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("to must be after from");
        }
        long total = activities.countStartingInRange(from, to);
        if (total == 0) {
            return Page.empty(request);
        }
        List<ActivitySummary> content = new ArrayList<>();
        for (CanonicalActivity activity : activities.findStartingInRange(from, to, request.offset(), request.limit())) {
            SecondaryAnnotation annotation = primaryAnnotation(activity.getId()).orElse(null);
            String path = annotation == null ? null : categoryPaths.pathOf(annotation.categoryId());
            content.add(ActivitySummary.of(activity, annotation, path));
        }
        return new Page<>(content, total, request.pageNumber(), request.limit());
    }

    public Optional<ActivityDetail> findById(long activityId) {
        return activities.findById(activityId).map(activity -> {
            List<SecondaryAnnotation> linked = annotations.findByCanonical(activityId);
            String path = linked.isEmpty() ? null : categoryPaths.pathOf(linked.get(0).categoryId());
            return new ActivityDetail(activity, sourceLinks.findByActivity(activityId), linked, path);
        });
    }

    /**
     * Finds the canonical activity a source row is linked to. GPS ids are accepted
     * with or without the annotation prefix.
     */
    public Optional<Long> findCanonicalIdBySource(SourceSystem source, String sourceNativeId) {
        String bare = NativeIdParser.normalizeSourceId(source, sourceNativeId);
        Optional<SourceLink> link = sourceLinks.findByNative(source, bare);
        if (link.isEmpty() && source == SourceSystem.GPS_PLATFORM) {
            link = sourceLinks.findByNative(source, NativeIdParser.encode(source, bare));
        }
        return link.map(SourceLink::canonicalActivityId);
    }

    /**
     * Native ids of every source linked to an activity, in annotation form
     * ({@code activity-<id>}, {@code st-<id>}).
     */
    public List<String> findNativeIds(long activityId) {
        return sourceLinks.findByActivity(activityId).stream()
                .map(link -> NativeIdParser.encode(link.sourceSystem(), link.normalizedNativeId()))
                .toList();
    }

    public Optional<Long> findCanonicalIdByAnnotation(String annotationNativeId) {
        return annotations.findByNativeId(annotationNativeId)
                .map(SecondaryAnnotation::canonicalActivityId);
    }

    private Optional<SecondaryAnnotation> primaryAnnotation(long activityId) {
        return annotations.findByCanonical(activityId).stream().findFirst();
    }
}
