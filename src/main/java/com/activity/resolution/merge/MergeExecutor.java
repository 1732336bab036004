package com.activity.resolution.merge;

import com.activity.resolution.audit.AuditAction;
import com.activity.resolution.audit.AuditService;
import com.activity.resolution.core.exception.ConsistencyException;
import com.activity.resolution.core.run.RunOptions;
import com.activity.resolution.logging.LogContext;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.AnnotationRepository;
import com.activity.resolution.store.SourceLinkRepository;
import com.activity.resolution.store.StoreConnection;
import com.activity.resolution.store.StoreTransaction;
import com.activity.resolution.tracing.Span;
import com.activity.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds operator-confirmed duplicate activities into the activity that is kept.
 *
 * <p>Each pair runs in its own transaction: source links and annotations of the
 * dropped activity are re-pointed to the kept one, then the dropped activity is
 * deleted. A pair naming a missing activity is skipped, so repeating a merge is
 * harmless. A store failure rolls back that pair only.</p>
 */
public class MergeExecutor {
    private static final Logger log = LoggerFactory.getLogger(MergeExecutor.class);

    static final String OPERATION = "merge";

    private final StoreConnection store;
    private final ActivityRepository activities;
    private final SourceLinkRepository sourceLinks;
    private final AnnotationRepository annotations;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final AuditService audit;

    public MergeExecutor(StoreConnection store, MetricsService metrics, TracingService tracing, AuditService audit) {
        this.store = store;
        this.activities = new ActivityRepository(store);
        this.sourceLinks = new SourceLinkRepository(store);
        this.annotations = new AnnotationRepository(store);
        this.metrics = metrics;
        this.tracing = tracing;
        this.audit = audit;
    }

    public MergeReport merge(List<MergePair> pairs, RunOptions options) {
        String runId = LogContext.generateRunId();
        Instant started = Instant.now();
        try (LogContext ctx = LogContext.forRun(runId, OPERATION);
             Span span = tracing.startRun(OPERATION, runId)) {
            log.info("merge.starting pairs={} dryRun={}", pairs.size(), options.isDryRun());
            span.setAttribute("pairs", pairs.size());

            List<MergeOutcome> outcomes = new ArrayList<>();
            for (MergePair pair : pairs) {
                MergeOutcome outcome = mergeOne(pair, options.isDryRun(), runId);
                outcomes.add(outcome);
                metrics.incrementMergeOutcome(outcome.status().getCode());
            }

            MergeReport report = new MergeReport(outcomes, options.isDryRun());
            metrics.recordRunDuration(OPERATION, Duration.between(started, Instant.now()));
            span.setAttribute("merged", report.count(MergeOutcome.Status.MERGED));
            span.setOutcome(report.count(MergeOutcome.Status.FAILED) == 0 ? Span.Outcome.OK : Span.Outcome.ERROR);
            log.info("merge.completed {}", report);
            return report;
        }
    }

    private MergeOutcome mergeOne(MergePair pair, boolean dryRun, String runId) {
        try (LogContext ctx = LogContext.forMerge(runId, pair.keepId(), pair.dropId())) {
            if (!activities.exists(pair.keepId())) {
                log.warn("merge.skipped keepId={} dropId={} reason=keep-missing", pair.keepId(), pair.dropId());
                return MergeOutcome.skipped(pair, "keep activity not found: " + pair.keepId());
            }
            if (!activities.exists(pair.dropId())) {
                log.warn("merge.skipped keepId={} dropId={} reason=drop-missing", pair.keepId(), pair.dropId());
                return MergeOutcome.skipped(pair, "drop activity not found: " + pair.dropId());
            }

            if (dryRun) {
                long links = sourceLinks.countByActivity(pair.dropId());
                long moved = annotations.countByCanonical(pair.dropId());
                log.info("merge.planned keepId={} dropId={} links={} annotations={}",
                        pair.keepId(), pair.dropId(), links, moved);
                return MergeOutcome.planned(pair, links, moved);
            }

            try {
                long links;
                long moved;
                try (StoreTransaction tx = store.begin()) {
                    links = sourceLinks.repoint(pair.dropId(), pair.keepId());
                    moved = annotations.repoint(pair.dropId(), pair.keepId());
                    if (activities.delete(pair.dropId()) != 1) {
                        throw new ConsistencyException("drop activity vanished during merge: " + pair.dropId());
                    }
                    tx.markSuccess();
                }
                audit.record(AuditAction.ACTIVITIES_MERGED, pair.keepId(), runId,
                        Map.of("dropId", pair.dropId(), "linksMoved", links, "annotationsMoved", moved));
                log.info("merge.pair.completed keepId={} dropId={} links={} annotations={}",
                        pair.keepId(), pair.dropId(), links, moved);
                return MergeOutcome.merged(pair, links, moved);
            } catch (ConsistencyException e) {
                log.error("merge.failed keepId={} dropId={} error={}", pair.keepId(), pair.dropId(), e.getMessage());
                return MergeOutcome.failed(pair, e.getMessage());
            }
        }
    }
}
