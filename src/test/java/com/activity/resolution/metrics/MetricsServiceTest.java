package com.activity.resolution.metrics;

import com.activity.resolution.core.model.MatchTier;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.core.model.TimezoneProvenance;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordRunDuration("ingest-strava", Duration.ofMillis(100));
                noOp.incrementIngested(SourceSystem.GPS_PLATFORM, MatchTier.NEW);
                noOp.incrementSkipped("ingest-strava", "parse");
                noOp.incrementTimezoneAssigned(TimezoneProvenance.ASSUMED_HOME);
                noOp.incrementMergeOutcome("merged");
                noOp.incrementAnnotationsUnlinked(3);
                noOp.recordClusterSize(2);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record run duration per operation")
        void recordRunDuration() {
            metrics.recordRunDuration("merge", Duration.ofMillis(150));
            metrics.recordRunDuration("merge", Duration.ofMillis(250));
            metrics.recordRunDuration("untangle", Duration.ofMillis(10));

            Timer timer = registry.find("activity.run.duration").tag("operation", "merge").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should count ingested rows by source and tier")
        void incrementIngested() {
            metrics.incrementIngested(SourceSystem.GPS_PLATFORM, MatchTier.NEW);
            metrics.incrementIngested(SourceSystem.GPS_PLATFORM, MatchTier.NEW);
            metrics.incrementIngested(SourceSystem.DESKTOP_LOG, MatchTier.TIER_A);

            Counter gps = registry.find("activity.ingested").tag("source", "strava").tag("tier", "new").counter();
            Counter desktop = registry.find("activity.ingested").tag("source", "sporttracks").tag("tier", "A").counter();

            assertNotNull(gps);
            assertEquals(2.0, gps.count());
            assertNotNull(desktop);
            assertEquals(1.0, desktop.count());
        }

        @Test
        @DisplayName("Should count skips, timezones and merge outcomes with tags")
        void taggedCounters() {
            metrics.incrementSkipped("ingest-sporttracks", "parse");
            metrics.incrementTimezoneAssigned(TimezoneProvenance.SOURCE_REPORTED);
            metrics.incrementMergeOutcome("skipped");
            metrics.incrementMergeOutcome("skipped");

            assertEquals(1.0, registry.find("activity.rows.skipped")
                    .tag("operation", "ingest-sporttracks").tag("reason", "parse").counter().count());
            assertEquals(1.0, registry.find("activity.timezone.assigned")
                    .tag("provenance", "source-reported").counter().count());
            assertEquals(2.0, registry.find("activity.merge").tag("outcome", "skipped").counter().count());
        }

        @Test
        @DisplayName("Should record unlinked annotations and cluster sizes")
        void untangleAndClusters() {
            metrics.incrementAnnotationsUnlinked(2);
            metrics.incrementAnnotationsUnlinked(1);
            metrics.recordClusterSize(3);
            metrics.recordClusterSize(2);

            assertEquals(3.0, registry.find("activity.annotation.unlinked").counter().count());
            DistributionSummary summary = registry.find("activity.duplicate.cluster.size").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(5.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.find("activity.category.cache.hit").counter().count());
            assertEquals(1.0, registry.find("activity.category.cache.miss").counter().count());
        }
    }
}
