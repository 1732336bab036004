package com.activity.resolution.ingest;

import com.activity.resolution.audit.AuditAction;
import com.activity.resolution.audit.AuditService;
import com.activity.resolution.core.exception.ConsistencyException;
import com.activity.resolution.core.exception.LookupException;
import com.activity.resolution.core.exception.ValueParseException;
import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.core.model.MatchTier;
import com.activity.resolution.core.model.NativeIdParser;
import com.activity.resolution.core.model.SourceLink;
import com.activity.resolution.core.run.OnlyFilter;
import com.activity.resolution.core.run.RunOptions;
import com.activity.resolution.logging.LogContext;
import com.activity.resolution.matching.CanonicalMatcher;
import com.activity.resolution.matching.MatchCandidate;
import com.activity.resolution.matching.MatchOutcome;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.AnnotationRepository;
import com.activity.resolution.store.SourceLinkRepository;
import com.activity.resolution.store.SourceRowRepository;
import com.activity.resolution.store.StoreConnection;
import com.activity.resolution.store.StoreTransaction;
import com.activity.resolution.tracing.Span;
import com.activity.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Brings unlinked native rows of one source into the canonical store.
 *
 * <p>Per run: rows without a link are loaded (anti-join in the store), normalized,
 * optionally on a worker pool, and then matched one by one in start order on the
 * calling thread. Each row is written in its own transaction: the new activity if
 * any, the source link, and the canonical reference of unlinked annotations that
 * name this row. A dry run writes nothing; activities it would create are kept in
 * memory so later rows of the same run match them as a real run would.
 * A row failing on a constraint or lookup is rolled back, recorded
 * and skipped; a {@code SetupException} halts the run.
 */
public class SourceIngestor {
    private static final Logger log = LoggerFactory.getLogger(SourceIngestor.class);

    private static final Comparator<IngestCandidate> START_ORDER = Comparator
            .comparing((IngestCandidate c) -> c.start().utcInstant())
            .thenComparing(IngestCandidate::nativeId);

    // above any real row id, so ties between planned and stored activities resolve as after insertion
    private static final long PLANNED_ID_BASE = Long.MAX_VALUE / 2;

    private final StoreConnection store;
    private final ActivityRepository activities;
    private final SourceLinkRepository sourceLinks;
    private final AnnotationRepository annotations;
    private final SourceRowRepository sourceRows;
    private final CanonicalMatcher matcher;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final AuditService audit;

    public SourceIngestor(StoreConnection store, CanonicalMatcher matcher, MetricsService metrics,
                          TracingService tracing, AuditService audit) {
        this.store = store;
        this.activities = new ActivityRepository(store);
        this.sourceLinks = new SourceLinkRepository(store);
        this.annotations = new AnnotationRepository(store);
        this.sourceRows = new SourceRowRepository(store);
        this.matcher = matcher;
        this.metrics = metrics;
        this.tracing = tracing;
        this.audit = audit;
    }

    public <R> IngestResult ingest(SourceAdapter<R> adapter, RunOptions options) {
        String operation = "ingest-" + adapter.source().getCode();
        String runId = LogContext.generateRunId();
        Instant started = Instant.now();

        try (LogContext ctx = LogContext.forRun(runId, operation);
             Span span = tracing.startRun(operation, runId)) {
            List<R> rows = select(adapter, adapter.loadUnlinked(sourceRows), options);
            log.info("ingest.starting source={} rows={} dryRun={} workers={}",
                    adapter.source().getCode(), rows.size(), options.isDryRun(), options.getWorkers());
            span.setAttribute("rows", rows.size());
            span.setAttribute("dryRun", options.isDryRun());

            Tally tally = new Tally();
            List<IngestCandidate> candidates = normalizeAll(adapter, rows, options.getWorkers(), tally);
            candidates.sort(START_ORDER);

            for (IngestCandidate candidate : candidates) {
                try (LogContext rowCtx = LogContext.forRow(adapter.source().getCode(), candidate.nativeId())) {
                    ingestOne(candidate, options.isDryRun(), runId, tally);
                } catch (ConsistencyException | LookupException e) {
                    log.warn("ingest.row.skipped nativeId={} reason={}", candidate.nativeId(), e.getMessage());
                    tally.error(candidate.nativeId(), null, e.getMessage());
                    metrics.incrementSkipped(operation, e.getClass().getSimpleName());
                    span.addEvent("row.skipped");
                }
            }

            IngestResult result = new IngestResult(adapter.source(), rows.size(), tally.created, tally.tierA,
                    tally.tierB, tally.errors.size(), tally.annotationsLinked, tally.errors, options.isDryRun());
            metrics.recordRunDuration(operation, Duration.between(started, Instant.now()));
            span.setAttribute("created", result.created());
            span.setAttribute("skipped", result.skipped());
            span.setOutcome(Span.Outcome.OK);
            log.info("ingest.completed {}", result);
            return result;
        }
    }

    private <R> List<R> select(SourceAdapter<R> adapter, List<R> rows, RunOptions options) {
        OnlyFilter only = options.getOnly();
        List<R> selected = new ArrayList<>();
        for (R row : rows) {
            if (!only.accepts(OnlyFilter.ID, adapter.nativeId(row)) || !only.accepts(OnlyFilter.SPORT, adapter.sport(row))) {
                continue;
            }
            selected.add(row);
            if (options.isLimited() && selected.size() >= options.getLimit()) {
                break;
            }
        }
        return selected;
    }

    private <R> List<IngestCandidate> normalizeAll(SourceAdapter<R> adapter, List<R> rows, int workers, Tally tally) {
        List<Normalized> normalized;
        if (workers > 1 && rows.size() > 1) {
            ExecutorService executor = Executors.newFixedThreadPool(workers);
            try {
                List<CompletableFuture<Normalized>> futures = rows.stream()
                        .map(row -> CompletableFuture.supplyAsync(() -> normalizeOne(adapter, row), executor))
                        .toList();
                normalized = futures.stream().map(CompletableFuture::join).toList();
            } finally {
                executor.shutdown();
            }
        } else {
            normalized = rows.stream().map(row -> normalizeOne(adapter, row)).toList();
        }

        List<IngestCandidate> candidates = new ArrayList<>();
        for (Normalized n : normalized) {
            if (n.candidate() != null) {
                candidates.add(n.candidate());
            } else {
                log.warn("ingest.row.skipped nativeId={} rawValue='{}' reason={}",
                        n.nativeId(), n.error().getRawValue(), n.error().getMessage());
                tally.error(n.nativeId(), n.error().getRawValue(), n.error().getMessage());
                metrics.incrementSkipped("ingest-" + adapter.source().getCode(), "parse");
            }
        }
        return candidates;
    }

    private <R> Normalized normalizeOne(SourceAdapter<R> adapter, R row) {
        String nativeId = adapter.nativeId(row);
        try {
            return new Normalized(nativeId, adapter.normalize(row), null);
        } catch (ValueParseException e) {
            return new Normalized(nativeId, null, e);
        }
    }

    private void ingestOne(IngestCandidate candidate, boolean dryRun, String runId, Tally tally) {
        MatchCandidate matchCandidate = candidate.toMatchCandidate();
        Instant from = matcher.windowStart(matchCandidate);
        Instant to = matcher.windowEnd(matchCandidate);
        List<CanonicalActivity> existing = activities.findStartingBetween(from, to);
        if (dryRun) {
            existing = new ArrayList<>(existing);
            for (CanonicalActivity planned : tally.planned) {
                Instant start = planned.getStartTimeUtc();
                if (!start.isBefore(from) && !start.isAfter(to)) {
                    existing.add(planned);
                }
            }
        }
        MatchOutcome outcome = matcher.decide(matchCandidate, existing);

        if (dryRun) {
            if (outcome.isLink()) {
                log.info("ingest.row.planned nativeId={} tier={} activityId={}", candidate.nativeId(),
                        outcome.tier().getCode(), describe(outcome.activityId()));
            } else {
                long plannedId = PLANNED_ID_BASE + tally.planned.size();
                tally.planned.add(newActivity(candidate, plannedId));
                log.info("ingest.row.planned nativeId={} tier={} activityId={}", candidate.nativeId(),
                        outcome.tier().getCode(), describe(plannedId));
            }
            tally.count(outcome.tier());
            return;
        }

        String annotationId = NativeIdParser.encode(candidate.source(), candidate.nativeId());
        long activityId;
        int linkedAnnotations;
        try (StoreTransaction tx = store.begin()) {
            activityId = outcome.isLink() ? outcome.activityId() : activities.insert(newActivity(candidate, null));
            sourceLinks.insert(newLink(candidate, activityId, outcome.tier()));
            linkedAnnotations = annotations.linkIfUnlinked(annotationId, activityId);
            tx.markSuccess();
        }

        tally.count(outcome.tier());
        tally.annotationsLinked += linkedAnnotations;
        metrics.incrementIngested(candidate.source(), outcome.tier());
        if (!outcome.isLink()) {
            audit.record(AuditAction.ACTIVITY_CREATED, activityId, runId,
                    Map.of("source", candidate.source().getCode(), "nativeId", candidate.nativeId()));
        }
        audit.record(AuditAction.SOURCE_LINKED, activityId, runId,
                Map.of("source", candidate.source().getCode(), "nativeId", candidate.nativeId(),
                        "tier", outcome.tier().getCode()));
        if (linkedAnnotations > 0) {
            audit.record(AuditAction.ANNOTATION_LINKED, activityId, runId, Map.of("annotationId", annotationId));
        }
        log.debug("ingest.row.written nativeId={} tier={} activityId={}",
                candidate.nativeId(), outcome.tier().getCode(), activityId);
    }

    private static String describe(long activityId) {
        return activityId >= PLANNED_ID_BASE ? "planned-" + (activityId - PLANNED_ID_BASE + 1) : String.valueOf(activityId);
    }

    private static CanonicalActivity newActivity(IngestCandidate candidate, Long id) {
        return CanonicalActivity.builder()
                .id(id)
                .startTimeUtc(candidate.start().utcInstant())
                .elapsedTimeS(candidate.durationS())
                .movingTimeS(candidate.movingTimeS())
                .distanceM(candidate.distanceM())
                .name(candidate.name())
                .sport(candidate.sport())
                .sourceQuality(candidate.sourceQuality())
                .build();
    }

    private static SourceLink newLink(IngestCandidate candidate, long activityId, MatchTier tier) {
        return new SourceLink(null, activityId, candidate.source(), candidate.nativeId(),
                candidate.start().utcInstant(), candidate.start().localText(), candidate.distanceM(),
                candidate.durationS(), candidate.sport(), candidate.payloadHash(), tier, Instant.now());
    }

    private record Normalized(String nativeId, IngestCandidate candidate, ValueParseException error) {
    }

    private static final class Tally {
        private long created;
        private long tierA;
        private long tierB;
        private long annotationsLinked;
        private final List<IngestResult.IngestError> errors = new ArrayList<>();
        private final List<CanonicalActivity> planned = new ArrayList<>();

        void count(MatchTier tier) {
            switch (tier) {
                case TIER_A -> tierA++;
                case TIER_B -> tierB++;
                case NEW -> created++;
            }
        }

        void error(String nativeId, String rawValue, String message) {
            errors.add(new IngestResult.IngestError(nativeId, rawValue, message));
        }
    }
}
