package com.activity.resolution.timezone;

import com.activity.resolution.audit.AuditAction;
import com.activity.resolution.audit.AuditService;
import com.activity.resolution.core.model.TimezoneProvenance;
import com.activity.resolution.core.run.OnlyFilter;
import com.activity.resolution.core.run.RunOptions;
import com.activity.resolution.logging.LogContext;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.StoreConnection;
import com.activity.resolution.tracing.Span;
import com.activity.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Fills timezone name, offset and provenance on canonical activities.
 *
 * <p>By default only activities without a zone are touched. A forced run
 * re-resolves every selected activity but keeps any whose stored provenance
 * outranks the new one unless downgrades are allowed. Resolution runs on the
 * worker pool; writes are serialized in chunked transactions.
 */
public class TimezoneBackfillService {
    private static final Logger log = LoggerFactory.getLogger(TimezoneBackfillService.class);

    static final String BACKFILL = "backfill-timezones";
    static final String RECOMPUTE = "recompute-offsets";

    private final ActivityRepository activities;
    private final TimezoneResolver resolver;
    private final AssignmentWriter writer;
    private final MetricsService metrics;
    private final TracingService tracing;

    public TimezoneBackfillService(StoreConnection store, TimezoneResolver resolver, MetricsService metrics,
                                   TracingService tracing, AuditService audit) {
        this.activities = new ActivityRepository(store);
        this.resolver = resolver;
        this.writer = new AssignmentWriter(store, metrics, audit, AssignmentWriter.DEFAULT_CHUNK_SIZE);
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Resolves and writes timezones.
     */
    public TimezoneRunResult backfill(RunOptions options) {
        List<TimezoneCandidate> candidates = select(activities.findTimezoneCandidates(!options.isForce()), options);
        return run(BACKFILL, candidates, resolver::resolve, options, AuditAction.TIMEZONE_ASSIGNED, true);
    }

    /**
     * Recomputes offsets for activities that already have a zone: those missing an
     * offset, or all of them when forced. Invalid zones are tagged {@code bad-timezone-name}.
     */
    public TimezoneRunResult recomputeOffsets(RunOptions options) {
        List<TimezoneCandidate> candidates = select(activities.findOffsetCandidates(!options.isForce()), options);
        return run(RECOMPUTE, candidates, resolver::recomputeOffset, options, AuditAction.OFFSET_RECOMPUTED, false);
    }

    private TimezoneRunResult run(String operation, List<TimezoneCandidate> candidates,
                                  Function<TimezoneCandidate, TimezoneAssignment> compute,
                                  RunOptions options, AuditAction action, boolean guardProvenance) {
        String runId = LogContext.generateRunId();
        Instant started = Instant.now();
        try (LogContext ctx = LogContext.forRun(runId, operation);
             Span span = tracing.startRun(operation, runId)) {
            log.info("timezone.run.starting operation={} activities={} force={} allowDowngrade={} dryRun={}",
                    operation, candidates.size(), options.isForce(), options.isAllowDowngrade(), options.isDryRun());
            span.setAttribute("activities", candidates.size());

            List<TimezoneAssignment> resolved = computeAll(candidates, compute, options.getWorkers());

            List<TimezoneAssignment> updates = new ArrayList<>();
            Map<Long, TimezoneCandidate> previous = new HashMap<>();
            Map<String, Long> byZone = new TreeMap<>();
            Map<String, Long> byProvenance = new TreeMap<>();
            long unchanged = 0;
            long protectedCount = 0;
            long badZones = 0;

            for (int i = 0; i < candidates.size(); i++) {
                TimezoneCandidate candidate = candidates.get(i);
                TimezoneAssignment assignment = resolved.get(i);
                if (assignment.provenance() == TimezoneProvenance.BAD_TIMEZONE_NAME) {
                    badZones++;
                    metrics.incrementSkipped(operation, "bad-timezone-name");
                }
                if (isUnchanged(candidate, assignment)) {
                    unchanged++;
                    continue;
                }
                if (guardProvenance && isProtected(candidate, assignment, options)) {
                    protectedCount++;
                    log.debug("timezone.protected activityId={} current={} proposed={}", candidate.activityId(),
                            effectiveProvenance(candidate).getCode(), assignment.provenance().getCode());
                    continue;
                }
                updates.add(assignment);
                previous.put(candidate.activityId(), candidate);
                byZone.merge(assignment.timezoneName(), 1L, Long::sum);
                byProvenance.merge(assignment.provenance().getCode(), 1L, Long::sum);
            }

            long failed = 0;
            if (options.isDryRun()) {
                updates.stream().limit(50).forEach(a -> log.info("timezone.planned activityId={} tzName={} offset={} provenance={}",
                        a.activityId(), a.timezoneName(), a.utcOffsetMinutes(), a.provenance().getCode()));
            } else {
                failed = writer.write(updates, previous, action, runId);
            }

            TimezoneRunResult result = new TimezoneRunResult(operation, candidates.size(), updates.size() - failed,
                    unchanged, protectedCount, badZones, failed, byZone, byProvenance, updates, options.isDryRun());
            metrics.recordRunDuration(operation, Duration.between(started, Instant.now()));
            span.setAttribute("updated", result.updated());
            span.setAttribute("protected", protectedCount);
            span.setOutcome(failed == 0 ? Span.Outcome.OK : Span.Outcome.ERROR);
            log.info("timezone.run.completed {}", result);
            return result;
        }
    }

    private List<TimezoneAssignment> computeAll(List<TimezoneCandidate> candidates,
                                                Function<TimezoneCandidate, TimezoneAssignment> compute,
                                                int workers) {
        if (workers <= 1 || candidates.size() <= 1) {
            return candidates.stream().map(compute).toList();
        }
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<CompletableFuture<TimezoneAssignment>> futures = candidates.stream()
                    .map(c -> CompletableFuture.supplyAsync(() -> compute.apply(c), executor))
                    .toList();
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            executor.shutdown();
        }
    }

    private static List<TimezoneCandidate> select(List<TimezoneCandidate> candidates, RunOptions options) {
        OnlyFilter only = options.getOnly();
        List<TimezoneCandidate> selected = new ArrayList<>();
        for (TimezoneCandidate c : candidates) {
            if (!only.accepts(OnlyFilter.ID, c.activityId())
                    || !only.accepts(OnlyFilter.CANONICAL, c.activityId())
                    || !only.accepts(OnlyFilter.SPORT, c.sport())
                    || !only.accepts(OnlyFilter.TZ_NAME, c.currentTimezoneName())
                    || !only.accepts(OnlyFilter.TZ_SOURCE, c.currentProvenance() == null ? null : c.currentProvenance().getCode())) {
                continue;
            }
            selected.add(c);
            if (options.isLimited() && selected.size() >= options.getLimit()) {
                break;
            }
        }
        return selected;
    }

    private static boolean isUnchanged(TimezoneCandidate candidate, TimezoneAssignment assignment) {
        return candidate.hasTimezone()
                && assignment.timezoneName().equals(candidate.currentTimezoneName())
                && Objects.equals(assignment.utcOffsetMinutes(), candidate.currentOffsetMinutes())
                && assignment.provenance() == candidate.currentProvenance();
    }

    private static boolean isProtected(TimezoneCandidate candidate, TimezoneAssignment assignment, RunOptions options) {
        if (!candidate.hasTimezone() || options.isAllowDowngrade()) {
            return false;
        }
        return effectiveProvenance(candidate).outranks(assignment.provenance());
    }

    /**
     * A zone stored without a tag was set by hand.
     */
    private static TimezoneProvenance effectiveProvenance(TimezoneCandidate candidate) {
        return candidate.currentProvenance() != null ? candidate.currentProvenance() : TimezoneProvenance.OPERATOR;
    }
}
