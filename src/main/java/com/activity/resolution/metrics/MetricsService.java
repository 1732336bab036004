package com.activity.resolution.metrics;

import com.activity.resolution.core.model.MatchTier;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.core.model.TimezoneProvenance;

import java.time.Duration;

/**
 * Records activity resolution metrics.
 * The default {@link NoOpMetricsService} does nothing; {@link MicrometerMetricsService}
 * publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordRunDuration(String operation, Duration duration);

    void incrementIngested(SourceSystem source, MatchTier tier);

    void incrementSkipped(String operation, String reason);

    void incrementTimezoneAssigned(TimezoneProvenance provenance);

    void incrementMergeOutcome(String outcome);

    void incrementAnnotationsUnlinked(int count);

    void recordClusterSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
