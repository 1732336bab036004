package com.activity.resolution.metrics;

import com.activity.resolution.core.model.MatchTier;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.core.model.TimezoneProvenance;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code activity.run.duration}: Timer (tag: operation)</li>
 *   <li>{@code activity.ingested}: Counter (tags: source, tier)</li>
 *   <li>{@code activity.rows.skipped}: Counter (tags: operation, reason)</li>
 *   <li>{@code activity.timezone.assigned}: Counter (tag: provenance)</li>
 *   <li>{@code activity.merge}: Counter (tag: outcome)</li>
 *   <li>{@code activity.annotation.unlinked}: Counter</li>
 *   <li>{@code activity.duplicate.cluster.size}: DistributionSummary</li>
 *   <li>{@code activity.category.cache.hit} / {@code .miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter unlinkedCounter;
    private final DistributionSummary clusterSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.unlinkedCounter = Counter.builder("activity.annotation.unlinked")
                .description("Annotations whose canonical reference was cleared by the untangler")
                .register(registry);
        this.clusterSizeSummary = DistributionSummary.builder("activity.duplicate.cluster.size")
                .description("Size of overlapping activity clusters")
                .register(registry);
        this.cacheHitCounter = Counter.builder("activity.category.cache.hit")
                .description("Category path cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("activity.category.cache.miss")
                .description("Category path cache misses")
                .register(registry);
    }

    @Override
    public void recordRunDuration(String operation, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(operation, k ->
                Timer.builder("activity.run.duration")
                        .description("Duration of batch runs")
                        .tag("operation", operation)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementIngested(SourceSystem source, MatchTier tier) {
        counter("ingested:" + source.getCode() + ":" + tier.getCode(), () ->
                Counter.builder("activity.ingested")
                        .description("Source rows ingested, by match tier")
                        .tag("source", source.getCode())
                        .tag("tier", tier.getCode())
                        .register(registry)).increment();
    }

    @Override
    public void incrementSkipped(String operation, String reason) {
        counter("skipped:" + operation + ":" + reason, () ->
                Counter.builder("activity.rows.skipped")
                        .description("Rows or pairs skipped by a run")
                        .tag("operation", operation)
                        .tag("reason", reason)
                        .register(registry)).increment();
    }

    @Override
    public void incrementTimezoneAssigned(TimezoneProvenance provenance) {
        counter("tz:" + provenance.getCode(), () ->
                Counter.builder("activity.timezone.assigned")
                        .description("Timezones written, by provenance")
                        .tag("provenance", provenance.getCode())
                        .register(registry)).increment();
    }

    @Override
    public void incrementMergeOutcome(String outcome) {
        counter("merge:" + outcome, () ->
                Counter.builder("activity.merge")
                        .description("Merge pairs processed, by outcome")
                        .tag("outcome", outcome)
                        .register(registry)).increment();
    }

    @Override
    public void incrementAnnotationsUnlinked(int count) {
        unlinkedCounter.increment(count);
    }

    @Override
    public void recordClusterSize(int size) {
        clusterSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
