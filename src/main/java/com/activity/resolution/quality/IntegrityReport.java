package com.activity.resolution.quality;

import java.util.Map;

/**
 * Read-only consistency counts over the canonical store.
 */
public record IntegrityReport(
        long activities,
        long sourceLinks,
        long activitiesWithoutSources,
        long activitiesWithoutTimezone,
        long orphanLinks,
        long linksWithoutNativeRow,
        long danglingAnnotations,
        long unlinkedAnnotations,
        long activitiesWithMultipleAnnotations,
        Map<String, Long> byProvenance
) {
    public IntegrityReport {
        byProvenance = Map.copyOf(byProvenance);
    }

    /**
     * True when no referential problem was found. Missing timezones and unlinked
     * annotations are normal states and do not count.
     */
    public boolean isConsistent() {
        return orphanLinks == 0 && danglingAnnotations == 0 && activitiesWithoutSources == 0;
    }
}
