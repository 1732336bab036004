package com.activity.resolution.metrics;

import com.activity.resolution.core.model.MatchTier;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.core.model.TimezoneProvenance;

import java.time.Duration;

/**
 * Metrics that record nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(String operation, Duration duration) {
        // no-op
    }

    @Override
    public void incrementIngested(SourceSystem source, MatchTier tier) {
        // no-op
    }

    @Override
    public void incrementSkipped(String operation, String reason) {
        // no-op
    }

    @Override
    public void incrementTimezoneAssigned(TimezoneProvenance provenance) {
        // no-op
    }

    @Override
    public void incrementMergeOutcome(String outcome) {
        // no-op
    }

    @Override
    public void incrementAnnotationsUnlinked(int count) {
        // no-op
    }

    @Override
    public void recordClusterSize(int size) {
        // no-op
    }

    @Override
    public void recordCacheHit() {
        // no-op
    }

    @Override
    public void recordCacheMiss() {
        // no-op
    }
}
