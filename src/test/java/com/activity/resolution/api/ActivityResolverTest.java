package com.activity.resolution.api;

import com.activity.resolution.audit.AuditAction;
import com.activity.resolution.core.exception.SetupException;
import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.core.model.TimezoneProvenance;
import com.activity.resolution.core.run.RunOptions;
import com.activity.resolution.ingest.IngestResult;
import com.activity.resolution.merge.MergeOutcome;
import com.activity.resolution.merge.MergePair;
import com.activity.resolution.merge.MergeReport;
import com.activity.resolution.quality.IntegrityReport;
import com.activity.resolution.store.SqliteStore;
import com.activity.resolution.testing.TestDatabase;
import com.activity.resolution.timezone.TimezoneOptions;
import com.activity.resolution.timezone.TimezoneRunResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ActivityResolver Tests")
class ActivityResolverTest {

    @TempDir
    Path tempDir;

    private TestDatabase db;
    private ActivityResolver resolver;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create(tempDir);
        resolver = ActivityResolver.builder()
                .store(db.store())
                .timezoneOptions(TimezoneOptions.builder().homeZone("America/Chicago").build())
                .build();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
        db.close();
    }

    @Nested
    @DisplayName("Full pipeline")
    class Pipeline {

        @Test
        @DisplayName("Ingest both sources, assign zones and stay consistent")
        void ingestBackfillCheck() {
            db.gpsRow("100", "2024-06-01 05:00:00", "Run", 10000.0, 3600L, "Lakefront", null);
            db.desktopRow("7", "2024-06-01", "05:03:00", 10050.0, 3620.0, "Running", null, null);
            db.annotation("st-7", null, true, null);

            IngestResult gps = resolver.ingestGps(RunOptions.defaults());
            IngestResult desktop = resolver.ingestDesktop(RunOptions.defaults());
            TimezoneRunResult zones = resolver.backfillTimezones(RunOptions.defaults());
            IntegrityReport report = resolver.checkIntegrity();

            assertEquals(1, gps.created());
            assertEquals(1, desktop.linkedTierA());
            assertEquals(1, desktop.annotationsLinked());
            assertEquals(1, zones.updated());
            assertTrue(report.isConsistent());
            assertEquals(1, report.activities());
            assertEquals(2, report.sourceLinks());
            assertEquals(0, report.activitiesWithoutTimezone());

            long id = resolver.queries()
                    .findCanonicalIdBySource(SourceSystem.DESKTOP_LOG, "7").orElseThrow();
            CanonicalActivity activity = resolver.queries().findById(id).orElseThrow().activity();
            assertEquals("America/Chicago", activity.getTimezoneName());
            assertEquals(TimezoneProvenance.ASSUMED_HOME, activity.getTimezoneProvenance());
            assertFalse(resolver.getAuditService().getEntriesByAction(AuditAction.ACTIVITY_CREATED).isEmpty());
        }

        @Test
        @DisplayName("Overlapping training activities are reported and then merged")
        void duplicatesThenMerge() {
            long first = db.activity("2024-06-01T12:00:00Z", 3600, 10000.0, "Run");
            db.link(first, SourceSystem.GPS_PLATFORM, "100");
            db.annotation("activity-100", null, true, first);
            long second = db.activity("2024-06-01T12:30:00Z", 3600, 10000.0, "Run");
            db.link(second, SourceSystem.DESKTOP_LOG, "7");
            db.annotation("st-7", null, true, second);

            assertEquals(1, resolver.findDuplicates().clusters().size());

            MergeReport merged = resolver.merge(List.of(new MergePair(first, second)), RunOptions.defaults());

            assertEquals(1, merged.count(MergeOutcome.Status.MERGED));
            assertTrue(resolver.findDuplicates().clusters().isEmpty());
            assertEquals(2, resolver.queries().findNativeIds(first).size());
        }
    }

    @Nested
    @DisplayName("Setup")
    class Setup {

        @Test
        @DisplayName("Operations on a store without the schema fail before writing")
        void missingSchema() {
            try (SqliteStore empty = SqliteStore.openOrCreate(tempDir.resolve("empty.db"));
                 ActivityResolver bare = ActivityResolver.builder().store(empty).build()) {
                SetupException e = assertThrows(SetupException.class, () -> bare.ingestGps(RunOptions.defaults()));
                assertTrue(e.getMessage().contains("missing table activity"));
            }
        }

        @Test
        @DisplayName("Builder requires a store and a positive cache size")
        void builderValidation() {
            assertThrows(NullPointerException.class, () -> ActivityResolver.builder().build());
            assertThrows(IllegalArgumentException.class, () -> ActivityResolver.builder().categoryCacheSize(0));
            assertThrows(SetupException.class, () -> ActivityResolver.builder().sqlite(tempDir.resolve("nope.db")));
        }
    }
}
