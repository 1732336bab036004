package com.activity.resolution.quality;

import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.AnnotationRepository;
import com.activity.resolution.store.SourceLinkRepository;
import com.activity.resolution.store.StoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IntegrityChecker {
    private static final Logger log = LoggerFactory.getLogger(IntegrityChecker.class);

    private final ActivityRepository activities;
    private final SourceLinkRepository sourceLinks;
    private final AnnotationRepository annotations;

    public IntegrityChecker(StoreConnection store) {
        this.activities = new ActivityRepository(store);
        this.sourceLinks = new SourceLinkRepository(store);
        this.annotations = new AnnotationRepository(store);
    }

    public IntegrityReport check() {
        IntegrityReport report = new IntegrityReport(
                activities.count(),
                sourceLinks.count(),
                activities.countWithoutSources(),
                activities.countWithoutTimezone(),
                sourceLinks.countOrphans(),
                sourceLinks.countMissingNativeRows(),
                annotations.countDangling(),
                annotations.countUnlinked(),
                annotations.findCanonicalIdsWithMultipleAnnotations().size(),
                activities.countByProvenance());
        if (report.isConsistent()) {
            log.info("integrity.checked {}", report);
        } else {
            log.warn("integrity.problems {}", report);
        }
        return report;
    }
}
