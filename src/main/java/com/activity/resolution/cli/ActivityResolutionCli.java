package com.activity.resolution.cli;

import com.activity.resolution.api.ActivityResolver;
import com.activity.resolution.config.EngineConfig;
import com.activity.resolution.core.exception.ResolutionException;
import com.activity.resolution.core.exception.SetupException;
import com.activity.resolution.duplicate.DetectorOptions;
import com.activity.resolution.duplicate.DuplicateCluster;
import com.activity.resolution.duplicate.DuplicateReport;
import com.activity.resolution.duplicate.OverlapPair;
import com.activity.resolution.duplicate.OverlapPairCsvWriter;
import com.activity.resolution.ingest.IngestResult;
import com.activity.resolution.merge.MergeOutcome;
import com.activity.resolution.merge.MergePairCsvReader;
import com.activity.resolution.merge.MergeReport;
import com.activity.resolution.metrics.MicrometerMetricsService;
import com.activity.resolution.quality.IntegrityReport;
import com.activity.resolution.quality.TimezoneMismatch;
import com.activity.resolution.store.SchemaManager;
import com.activity.resolution.store.SqliteStore;
import com.activity.resolution.store.StoreConnection;
import com.activity.resolution.timezone.TimezoneOptions;
import com.activity.resolution.timezone.TimezoneRunResult;
import com.activity.resolution.untangle.UntangleRecommendation;
import com.activity.resolution.untangle.UntangleResult;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 *
 * <p>Exit codes: 0 when the command completed, even if single rows or pairs were
 * skipped; 1 on an unexpected failure; 2 on a usage error; 3 when the database
 * cannot be used.</p>
 */
public class ActivityResolutionCli {
    private static final Logger log = LoggerFactory.getLogger(ActivityResolutionCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_SETUP = 3;

    private static final int REPORT_SAMPLE = 50;

    private final PrintStream out;
    private final PrintStream err;
    private final EngineConfig config;

    public ActivityResolutionCli(PrintStream out, PrintStream err, EngineConfig config) {
        this.out = out;
        this.err = err;
        this.config = config;
    }

    public static void main(String[] args) {
        EngineConfig config;
        try {
            config = EngineConfig.load();
        } catch (IllegalArgumentException e) {
            System.err.println("error: invalid configuration: " + e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }
        System.exit(new ActivityResolutionCli(System.out, System.err, config).run(args));
    }

    public int run(String[] args) {
        CliArguments arguments;
        Path database;
        TimezoneOptions timezoneOptions;
        DetectorOptions detectorOptions;
        try {
            arguments = CliArguments.parse(args, config.getWorkers());
            database = arguments.getDatabase()
                    .or(() -> config.getDatabasePath().map(Path::of))
                    .orElseThrow(() -> new UsageException("--db is required"));
            timezoneOptions = arguments.getHomeZone()
                    .map(config::timezoneOptionsWithHome)
                    .orElse(config.getTimezoneOptions());
            detectorOptions = detectorOptions(arguments);
        } catch (UsageException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            printUsage();
            return EXIT_USAGE;
        }

        try {
            if (arguments.getCommand() == Command.INIT_DB) {
                try (SqliteStore store = SqliteStore.openOrCreate(database)) {
                    new SchemaManager(store).createSchema();
                }
                out.println("schema ready: " + database);
                return EXIT_OK;
            }
            try (StoreConnection store = isReadOnly(arguments.getCommand())
                    ? SqliteStore.openReadOnly(database) : SqliteStore.open(database)) {
                SimpleMeterRegistry registry = new SimpleMeterRegistry();
                ActivityResolver resolver = ActivityResolver.builder()
                        .store(store)
                        .timezoneOptions(timezoneOptions)
                        .matchingOptions(config.getMatchingOptions())
                        .detectorOptions(detectorOptions)
                        .categoryCacheSize(config.getCategoryCacheSize())
                        .metricsService(new MicrometerMetricsService(registry))
                        .build();
                try (resolver) {
                    execute(arguments, resolver);
                }
                logMeters(registry);
            }
            return EXIT_OK;
        } catch (SetupException e) {
            log.error("cli.setup.failed command={} db={} reason={}", arguments.getCommand().getName(), database, e.getMessage());
            err.println("error: " + e.getMessage());
            return EXIT_SETUP;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (ResolutionException | IOException e) {
            log.error("cli.failed command={} reason={}", arguments.getCommand().getName(), e.getMessage(), e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void execute(CliArguments arguments, ActivityResolver resolver) throws IOException {
        switch (arguments.getCommand()) {
            case INGEST_GPS -> printIngest(resolver.ingestGps(arguments.getRunOptions()));
            case INGEST_DESKTOP -> printIngest(resolver.ingestDesktop(arguments.getRunOptions()));
            case BACKFILL_TIMEZONES -> printTimezone(resolver.backfillTimezones(arguments.getRunOptions()));
            case RECOMPUTE_OFFSETS -> printTimezone(resolver.recomputeOffsets(arguments.getRunOptions()));
            case FIND_DUPLICATES -> printDuplicates(resolver.findDuplicates(), arguments);
            case FIND_TZ_MISMATCHES -> printMismatches(resolver.findTimezoneMismatches(), arguments);
            case UNTANGLE -> printUntangle(resolver.untangle(arguments.getRunOptions()));
            case MERGE -> runMerge(resolver, arguments);
            case CHECK_INTEGRITY -> printIntegrity(resolver.checkIntegrity());
            case INIT_DB -> throw new IllegalStateException("init-db is handled before the store is opened");
        }
    }

    private static boolean isReadOnly(Command command) {
        return command == Command.FIND_DUPLICATES
                || command == Command.FIND_TZ_MISMATCHES
                || command == Command.CHECK_INTEGRITY;
    }

    private DetectorOptions detectorOptions(CliArguments arguments) {
        DetectorOptions defaults = config.getDetectorOptions();
        return DetectorOptions.builder()
                .minOverlap(arguments.getMinOverlapSeconds().map(Duration::ofSeconds).orElse(defaults.getMinOverlap()))
                .tolerance(arguments.getToleranceSeconds().map(Duration::ofSeconds).orElse(defaults.getTolerance()))
                .build();
    }

    private void printIngest(IngestResult result) {
        out.println(result);
        result.errors().forEach(e -> out.printf("  skipped %s: %s%s%n", e.nativeId(), e.message(),
                e.rawValue() == null ? "" : " (raw '" + e.rawValue() + "')"));
    }

    private void printTimezone(TimezoneRunResult result) {
        out.println(result);
        printCounts("by zone", result.byZone());
        printCounts("by provenance", result.byProvenance());
        if (result.dryRun()) {
            result.updates().stream().limit(REPORT_SAMPLE).forEach(a -> out.printf("  activity %d -> %s %s %s%n",
                    a.activityId(), a.timezoneName(), a.utcOffsetMinutes(), a.provenance().getCode()));
        }
    }

    private void printDuplicates(DuplicateReport report, CliArguments arguments) throws IOException {
        out.printf("examined=%d excluded=%d pairs=%d clusters=%d%n", report.examined(), report.excluded().size(),
                report.pairs().size(), report.clusters().size());
        for (DuplicateCluster cluster : report.clusters()) {
            out.printf("  cluster size=%d ids=%s%n", cluster.size(), cluster.ids());
        }
        for (OverlapPair pair : report.pairs().stream().limit(REPORT_SAMPLE).toList()) {
            out.printf("  overlap %ds: %d (%s) / %d (%s)%n", pair.overlapSeconds(),
                    pair.first().activityId(), pair.first().name(), pair.second().activityId(), pair.second().name());
        }
        if (!report.excluded().isEmpty()) {
            out.println("  excluded (no usable interval): " + report.excluded());
        }
        if (arguments.getCsv().isPresent()) {
            Path csv = arguments.getCsv().get();
            try (Writer writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
                new OverlapPairCsvWriter().write(report.pairs(), writer);
            }
            out.println("pairs written to " + csv);
        }
    }

    private void printMismatches(List<TimezoneMismatch> mismatches, CliArguments arguments) throws IOException {
        out.printf("timezone mismatch candidates=%d%n", mismatches.size());
        for (TimezoneMismatch m : mismatches) {
            out.printf("  gps %d / desktop %d offset=%+dh residual=%ds distanceDelta=%.0fm%n", m.gpsActivityId(),
                    m.desktopActivityId(), m.offsetHours(), m.residualSeconds(), m.distanceDeltaM());
        }
        if (arguments.getCsv().isPresent()) {
            Path csv = arguments.getCsv().get();
            try (Writer writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
                writer.write("keep_id,drop_id\n");
                for (TimezoneMismatch m : mismatches) {
                    writer.write(m.gpsActivityId() + "," + m.desktopActivityId() + "\n");
                }
            }
            out.println("merge candidates written to " + csv);
        }
    }

    private void printUntangle(UntangleResult result) {
        out.println(result);
        for (UntangleRecommendation r : result.recommendations().stream().limit(REPORT_SAMPLE).toList()) {
            out.printf("  activity %d keep %s unlink %s (%s)%n", r.activityId(), r.keepNativeId(),
                    r.unlinkNativeIds(), r.reason().getCode());
        }
    }

    private void runMerge(ActivityResolver resolver, CliArguments arguments) throws IOException {
        Path pairsFile = arguments.getPairs().orElseThrow();
        MergePairCsvReader.Result input;
        try (Reader reader = Files.newBufferedReader(pairsFile, StandardCharsets.UTF_8)) {
            input = new MergePairCsvReader().read(reader);
        }
        input.errors().forEach(e -> out.printf("  invalid line %d '%s': %s%n", e.lineNumber(), e.row(), e.message()));

        MergeReport report = resolver.merge(input.pairs(), arguments.getRunOptions());
        out.println(report);
        for (MergeOutcome outcome : report.outcomes()) {
            out.printf("  %d <- %d %s links=%d annotations=%d%s%n", outcome.pair().keepId(), outcome.pair().dropId(),
                    outcome.status().getCode(), outcome.linksMoved(), outcome.annotationsMoved(),
                    outcome.message() == null ? "" : " (" + outcome.message() + ")");
        }
    }

    private void printIntegrity(IntegrityReport report) {
        out.printf("activities=%d sourceLinks=%d%n", report.activities(), report.sourceLinks());
        out.printf("activitiesWithoutSources=%d activitiesWithoutTimezone=%d%n",
                report.activitiesWithoutSources(), report.activitiesWithoutTimezone());
        out.printf("orphanLinks=%d linksWithoutNativeRow=%d%n", report.orphanLinks(), report.linksWithoutNativeRow());
        out.printf("danglingAnnotations=%d unlinkedAnnotations=%d activitiesWithMultipleAnnotations=%d%n",
                report.danglingAnnotations(), report.unlinkedAnnotations(), report.activitiesWithMultipleAnnotations());
        printCounts("by provenance", report.byProvenance());
        out.println(report.isConsistent() ? "consistent" : "PROBLEMS FOUND");
    }

    private void printCounts(String title, Map<String, Long> counts) {
        if (counts.isEmpty()) {
            return;
        }
        out.println("  " + title + ":");
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .forEach(e -> out.printf("    %s: %d%n", e.getKey(), e.getValue()));
    }

    private void printUsage() {
        err.println("usage: activity-resolution <command> [--db path] [--dry-run] [--force] [--allow-downgrade]");
        err.println("       [--limit N] [--only key=value[,key=value]] [--csv path] [--pairs path] [--home-tz zone]");
        err.println("       [--workers N] [--min-overlap seconds] [--tolerance seconds]");
        err.println("commands:");
        for (Command command : Command.values()) {
            err.printf("  %-20s %s%n", command.getName(), command.getDescription());
        }
        err.println("--only keys: id, canonical, sport, tz_name, tz_source");
    }

    private static void logMeters(SimpleMeterRegistry registry) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (Meter meter : registry.getMeters()) {
            meter.measure().forEach(m -> log.debug("metric name={} tags={} {}={}", meter.getId().getName(),
                    meter.getId().getTags(), m.getStatistic(), m.getValue()));
        }
    }
}
