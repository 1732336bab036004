package com.activity.resolution.untangle;

import com.activity.resolution.audit.AuditAction;
import com.activity.resolution.audit.AuditService;
import com.activity.resolution.core.exception.ConsistencyException;
import com.activity.resolution.core.exception.LookupException;
import com.activity.resolution.core.model.SecondaryAnnotation;
import com.activity.resolution.core.run.OnlyFilter;
import com.activity.resolution.core.run.RunOptions;
import com.activity.resolution.logging.LogContext;
import com.activity.resolution.metrics.MetricsService;
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
 * Repairs activities referenced by several annotations: one annotation keeps the
 * reference, the others are unlinked. Annotations are never deleted.
 */
public class UntangleService {
    private static final Logger log = LoggerFactory.getLogger(UntangleService.class);

    static final String OPERATION = "untangle";

    private final StoreConnection store;
    private final AnnotationRepository annotations;
    private final SourceLinkRepository sourceLinks;
    private final LinkUntangler untangler;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final AuditService audit;

    public UntangleService(StoreConnection store, LinkUntangler untangler, MetricsService metrics,
                           TracingService tracing, AuditService audit) {
        this.store = store;
        this.annotations = new AnnotationRepository(store);
        this.sourceLinks = new SourceLinkRepository(store);
        this.untangler = untangler;
        this.metrics = metrics;
        this.tracing = tracing;
        this.audit = audit;
    }

    public UntangleResult untangle(RunOptions options) {
        String runId = LogContext.generateRunId();
        Instant started = Instant.now();
        try (LogContext ctx = LogContext.forRun(runId, OPERATION);
             Span span = tracing.startRun(OPERATION, runId)) {
            List<UntangleRecommendation> recommendations = plan(options);
            log.info("untangle.starting activities={} dryRun={}", recommendations.size(), options.isDryRun());
            span.setAttribute("activities", recommendations.size());

            long applied = 0;
            long unlinked = 0;
            long failed = 0;
            for (UntangleRecommendation recommendation : recommendations) {
                try (LogContext activityCtx = LogContext.forActivity(recommendation.activityId())) {
                    log.info("untangle.decided activityId={} keep={} unlink={} reason={}",
                            recommendation.activityId(), recommendation.keepNativeId(),
                            recommendation.unlinkNativeIds(), recommendation.reason().getCode());
                    if (options.isDryRun()) {
                        unlinked += recommendation.unlinkNativeIds().size();
                        continue;
                    }
                    unlinked += apply(recommendation, runId);
                    applied++;
                } catch (ConsistencyException | LookupException e) {
                    failed++;
                    log.warn("untangle.failed activityId={} reason={}", recommendation.activityId(), e.getMessage());
                    metrics.incrementSkipped(OPERATION, e.getClass().getSimpleName());
                    span.addEvent("activity.failed");
                }
            }

            UntangleResult result = new UntangleResult(recommendations.size(), applied, unlinked, failed,
                    recommendations, options.isDryRun());
            metrics.recordRunDuration(OPERATION, Duration.between(started, Instant.now()));
            span.setAttribute("unlinked", unlinked);
            span.setOutcome(failed == 0 ? Span.Outcome.OK : Span.Outcome.ERROR);
            log.info("untangle.completed {}", result);
            return result;
        }
    }

    /**
     * Computes decisions for the selected activities without writing anything.
     */
    public List<UntangleRecommendation> plan(RunOptions options) {
        OnlyFilter only = options.getOnly();
        List<UntangleRecommendation> recommendations = new ArrayList<>();
        for (Long activityId : annotations.findCanonicalIdsWithMultipleAnnotations()) {
            if (!only.accepts(OnlyFilter.CANONICAL, activityId)) {
                continue;
            }
            List<SecondaryAnnotation> linked = annotations.findByCanonical(activityId);
            if (only.constrains(OnlyFilter.ID)
                    && linked.stream().noneMatch(a -> only.accepts(OnlyFilter.ID, a.nativeId()))) {
                continue;
            }
            untangler.decide(activityId, linked, sourceLinks.findByActivity(activityId))
                    .ifPresent(recommendations::add);
            if (options.isLimited() && recommendations.size() >= options.getLimit()) {
                break;
            }
        }
        return recommendations;
    }

    private int apply(UntangleRecommendation recommendation, String runId) {
        int count = 0;
        try (StoreTransaction tx = store.begin()) {
            for (String nativeId : recommendation.unlinkNativeIds()) {
                count += annotations.unlink(nativeId);
            }
            tx.markSuccess();
        }
        metrics.incrementAnnotationsUnlinked(count);
        audit.record(AuditAction.ANNOTATION_UNLINKED, recommendation.activityId(), runId,
                Map.of("kept", recommendation.keepNativeId(),
                        "unlinked", recommendation.unlinkNativeIds(),
                        "reason", recommendation.reason().getCode()));
        return count;
    }
}
