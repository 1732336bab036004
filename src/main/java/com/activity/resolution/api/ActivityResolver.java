package com.activity.resolution.api;

import com.activity.resolution.audit.AuditService;
import com.activity.resolution.category.CategoryPathCache;
import com.activity.resolution.core.run.RunOptions;
import com.activity.resolution.duplicate.DetectorOptions;
import com.activity.resolution.duplicate.DuplicateClusterDetector;
import com.activity.resolution.duplicate.DuplicateReport;
import com.activity.resolution.ingest.DesktopSourceAdapter;
import com.activity.resolution.ingest.GpsSourceAdapter;
import com.activity.resolution.ingest.IngestResult;
import com.activity.resolution.ingest.SourceIngestor;
import com.activity.resolution.matching.CanonicalMatcher;
import com.activity.resolution.matching.MatchingOptions;
import com.activity.resolution.merge.MergeExecutor;
import com.activity.resolution.merge.MergePair;
import com.activity.resolution.merge.MergeReport;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.metrics.NoOpMetricsService;
import com.activity.resolution.quality.IntegrityChecker;
import com.activity.resolution.quality.IntegrityReport;
import com.activity.resolution.quality.TimezoneMismatch;
import com.activity.resolution.quality.TimezoneMismatchFinder;
import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.CategoryRepository;
import com.activity.resolution.store.SchemaVerifier;
import com.activity.resolution.store.SqliteStore;
import com.activity.resolution.store.StoreConnection;
import com.activity.resolution.store.Tables;
import com.activity.resolution.time.TemporalNormalizer;
import com.activity.resolution.timezone.TimezoneBackfillService;
import com.activity.resolution.timezone.TimezoneOptions;
import com.activity.resolution.timezone.TimezoneResolver;
import com.activity.resolution.timezone.TimezoneRunResult;
import com.activity.resolution.tracing.NoOpTracingService;
import com.activity.resolution.tracing.TracingService;
import com.activity.resolution.untangle.LinkUntangler;
import com.activity.resolution.untangle.UntangleResult;
import com.activity.resolution.untangle.UntangleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the activity resolution engine. Wires the store, the matching
 * and timezone rules and the ambient services, and exposes every batch operation.
 *
 * <pre>
 * try (ActivityResolver resolver = ActivityResolver.builder()
 *         .sqlite(Path.of("training.db"))
 *         .timezoneOptions(TimezoneOptions.builder().homeZone("America/Denver").build())
 *         .build()) {
 *     resolver.ingestGps(RunOptions.defaults());
 *     resolver.ingestDesktop(RunOptions.defaults());
 *     resolver.backfillTimezones(RunOptions.defaults());
 * }
 * </pre>
 *
 * <p>Each operation checks the tables it needs before it writes anything.</p>
 */
public class ActivityResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ActivityResolver.class);

    private final StoreConnection store;
    private final boolean ownsStore;
    private final SchemaVerifier schema;
    private final SourceIngestor ingestor;
    private final GpsSourceAdapter gpsAdapter;
    private final DesktopSourceAdapter desktopAdapter;
    private final TimezoneBackfillService timezoneService;
    private final DuplicateClusterDetector duplicateDetector;
    private final TimezoneMismatchFinder mismatchFinder;
    private final UntangleService untangleService;
    private final MergeExecutor mergeExecutor;
    private final IntegrityChecker integrityChecker;
    private final ActivityRepository activities;
    private final CategoryPathCache categoryPaths;
    private final ActivityQueryService queries;
    private final AuditService auditService;

    private ActivityResolver(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "a store is required");
        this.ownsStore = builder.ownsStore;
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();

        this.schema = new SchemaVerifier(store);
        this.activities = new ActivityRepository(store);

        TemporalNormalizer normalizer = new TemporalNormalizer();
        ZoneId homeZone = ZoneId.of(builder.timezoneOptions.getHomeZone());
        this.gpsAdapter = new GpsSourceAdapter(normalizer, homeZone);
        this.desktopAdapter = new DesktopSourceAdapter(normalizer, homeZone);
        this.ingestor = new SourceIngestor(store, new CanonicalMatcher(builder.matchingOptions),
                metrics, tracing, auditService);
        this.timezoneService = new TimezoneBackfillService(store, new TimezoneResolver(builder.timezoneOptions),
                metrics, tracing, auditService);
        this.duplicateDetector = new DuplicateClusterDetector(builder.detectorOptions, metrics);
        this.mismatchFinder = new TimezoneMismatchFinder(activities);
        this.untangleService = new UntangleService(store, new LinkUntangler(), metrics, tracing, auditService);
        this.mergeExecutor = new MergeExecutor(store, metrics, tracing, auditService);
        this.integrityChecker = new IntegrityChecker(store);
        this.categoryPaths = new CategoryPathCache(new CategoryRepository(store), metrics, builder.categoryCacheSize);
        this.queries = new ActivityQueryService(store, categoryPaths);

        log.info("ActivityResolver initialized: store={} homeZone={}", store.getLocation(), homeZone);
    }

    // ========== Batch operations ==========

    public IngestResult ingestGps(RunOptions options) {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.GPS_ACTIVITY, Tables.TRAINING_LOG);
        return ingestor.ingest(gpsAdapter, options);
    }

    public IngestResult ingestDesktop(RunOptions options) {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.DESKTOP_ACTIVITY, Tables.TRAINING_LOG);
        return ingestor.ingest(desktopAdapter, options);
    }

    public TimezoneRunResult backfillTimezones(RunOptions options) {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.GPS_ACTIVITY);
        return timezoneService.backfill(options);
    }

    public TimezoneRunResult recomputeOffsets(RunOptions options) {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.GPS_ACTIVITY);
        return timezoneService.recomputeOffsets(options);
    }

    /**
     * Reports overlapping training activities. Never writes.
     */
    public DuplicateReport findDuplicates() {
        schema.require(Tables.ACTIVITY, Tables.TRAINING_LOG);
        return duplicateDetector.detect(activities.findTrainingActivities());
    }

    /**
     * Reports GPS-only and desktop-only activity pairs offset by whole hours. Never writes.
     */
    public List<TimezoneMismatch> findTimezoneMismatches() {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE);
        return mismatchFinder.find();
    }

    public UntangleResult untangle(RunOptions options) {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.TRAINING_LOG);
        return untangleService.untangle(options);
    }

    public MergeReport merge(List<MergePair> pairs, RunOptions options) {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.TRAINING_LOG);
        return mergeExecutor.merge(pairs, options);
    }

    public IntegrityReport checkIntegrity() {
        schema.require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.GPS_ACTIVITY, Tables.DESKTOP_ACTIVITY,
                Tables.TRAINING_LOG);
        return integrityChecker.check();
    }

    // ========== Queries ==========

    public ActivityQueryService queries() {
        return queries;
    }

    /**
     * Drops cached category paths so operator edits become visible.
     */
    public void refreshCategories() {
        categoryPaths.invalidateAll();
    }

    public AuditService getAuditService() {
        return auditService;
    }

    @Override
    public void close() {
        categoryPaths.invalidateAll();
        if (ownsStore) {
            store.close();
            log.info("ActivityResolver closed");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StoreConnection store;
        private boolean ownsStore;
        private MatchingOptions matchingOptions = MatchingOptions.defaults();
        private TimezoneOptions timezoneOptions = TimezoneOptions.defaults();
        private DetectorOptions detectorOptions = DetectorOptions.defaults();
        private long categoryCacheSize = 1_000;
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuditService auditService;

        /**
         * Uses an existing store; the caller closes it.
         */
        public Builder store(StoreConnection store) {
            this.store = store;
            this.ownsStore = false;
            return this;
        }

        /**
         * Opens an existing SQLite database owned by the resolver.
         */
        public Builder sqlite(Path databaseFile) {
            this.store = SqliteStore.open(databaseFile);
            this.ownsStore = true;
            return this;
        }

        public Builder matchingOptions(MatchingOptions matchingOptions) {
            this.matchingOptions = Objects.requireNonNull(matchingOptions);
            return this;
        }

        public Builder timezoneOptions(TimezoneOptions timezoneOptions) {
            this.timezoneOptions = Objects.requireNonNull(timezoneOptions);
            return this;
        }

        public Builder detectorOptions(DetectorOptions detectorOptions) {
            this.detectorOptions = Objects.requireNonNull(detectorOptions);
            return this;
        }

        public Builder categoryCacheSize(long categoryCacheSize) {
            if (categoryCacheSize <= 0) {
                throw new IllegalArgumentException("categoryCacheSize must be > 0");
            }
            this.categoryCacheSize = categoryCacheSize;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public ActivityResolver build() {
            return new ActivityResolver(this);
        }
    }
}
