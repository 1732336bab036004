package com.activity.resolution.quality;

import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.core.model.TimezoneProvenance;
import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.ActivityRepository.SourceCoverage;
import com.activity.resolution.testing.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Quality report Tests")
class QualityReportsTest {

    @TempDir
    Path tempDir;

    private TestDatabase db;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create(tempDir);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private long gpsOnly(String start, double distance, String nativeId) {
        long id = db.activity(start, 3600, distance, "Run");
        db.link(id, SourceSystem.GPS_PLATFORM, nativeId);
        return id;
    }

    private long desktopOnly(String start, double distance, String nativeId) {
        long id = db.activity(start, 3600, distance, "Run");
        db.link(id, SourceSystem.DESKTOP_LOG, nativeId);
        return id;
    }

    @Nested
    @DisplayName("Timezone mismatch finder")
    class Mismatches {

        @Test
        @DisplayName("Whole-hour shift with similar distance pairs GPS-only with desktop-only")
        void findsShiftedPair() {
            long gps = gpsOnly("2024-06-01T12:00:00Z", 10000.0, "100");
            long desktop = desktopOnly("2024-06-01T17:02:00Z", 10400.0, "7");
            gpsOnly("2024-06-03T12:00:00Z", 10000.0, "101");

            List<TimezoneMismatch> found = new TimezoneMismatchFinder(new ActivityRepository(db.store())).find();

            assertEquals(1, found.size());
            TimezoneMismatch mismatch = found.get(0);
            assertEquals(gps, mismatch.gpsActivityId());
            assertEquals(desktop, mismatch.desktopActivityId());
            assertEquals(5, mismatch.offsetHours());
            assertEquals(120, mismatch.residualSeconds());
            assertEquals(400.0, mismatch.distanceDeltaM(), 0.001);
        }

        @Test
        @DisplayName("Activities with both sources are not candidates")
        void skipsReconciled() {
            long both = gpsOnly("2024-06-01T12:00:00Z", 10000.0, "100");
            db.link(both, SourceSystem.DESKTOP_LOG, "8");
            desktopOnly("2024-06-01T17:00:00Z", 10000.0, "7");

            assertTrue(new TimezoneMismatchFinder(new ActivityRepository(db.store())).find().isEmpty());
        }

        @Test
        @DisplayName("Rules: nonzero hours, residual tolerance, distance and missing values")
        void matchRules() {
            Instant gpsStart = Instant.parse("2024-06-01T12:00:00Z");
            SourceCoverage gps = new SourceCoverage(1, gpsStart, 10000.0, 1, 0);

            assertTrue(TimezoneMismatchFinder.match(gps, desktop(gpsStart.plusSeconds(60), 10000.0)).isEmpty());
            assertTrue(TimezoneMismatchFinder.match(gps, desktop(gpsStart.plusSeconds(3600 + 301), 10000.0)).isEmpty());
            assertTrue(TimezoneMismatchFinder.match(gps, desktop(gpsStart.plusSeconds(3600), 11001.0)).isEmpty());
            assertTrue(TimezoneMismatchFinder.match(gps, desktop(gpsStart.plusSeconds(13 * 3600), 10000.0)).isEmpty());
            assertTrue(TimezoneMismatchFinder.match(gps, desktop(gpsStart.plusSeconds(3600), null)).isEmpty());

            Optional<TimezoneMismatch> west = TimezoneMismatchFinder.match(gps,
                    desktop(gpsStart.minusSeconds(6 * 3600 - 30), 10000.0));
            assertTrue(west.isPresent());
            assertEquals(-6, west.get().offsetHours());
            assertEquals(30, west.get().residualSeconds());
        }

        private SourceCoverage desktop(Instant start, Double distance) {
            return new SourceCoverage(2, start, distance, 0, 1);
        }
    }

    @Nested
    @DisplayName("Integrity checker")
    class Integrity {

        @Test
        @DisplayName("Fully linked store is consistent")
        void consistent() {
            long id = db.activityWithZone("2024-06-01T12:00:00Z", "America/Chicago", -300,
                    TimezoneProvenance.ASSUMED_HOME);
            db.gpsRow("100", "2024-06-01T12:00:00Z", "Run", 10000.0, 3600L, "r", null);
            db.link(id, SourceSystem.GPS_PLATFORM, "activity-100");
            db.annotation("activity-100", null, true, id);

            IntegrityReport report = new IntegrityChecker(db.store()).check();

            assertTrue(report.isConsistent());
            assertEquals(1, report.activities());
            assertEquals(1, report.sourceLinks());
            assertEquals(0, report.linksWithoutNativeRow());
            assertEquals(0, report.activitiesWithoutTimezone());
            assertEquals(1L, report.byProvenance().get("assumed-home"));
        }

        @Test
        @DisplayName("Counts activities without sources and links without native rows")
        void problems() {
            db.activity("2024-06-01T12:00:00Z", 3600, 10000.0, "Run");
            long linked = db.activity("2024-06-02T12:00:00Z", 3600, 10000.0, "Run");
            db.link(linked, SourceSystem.DESKTOP_LOG, "404");
            db.annotation("st-404", null, true, linked);
            db.annotation("st-405", null, true, linked);
            db.annotation("st-406", null, false, null);

            IntegrityReport report = new IntegrityChecker(db.store()).check();

            assertFalse(report.isConsistent());
            assertEquals(1, report.activitiesWithoutSources());
            assertEquals(1, report.linksWithoutNativeRow());
            assertEquals(2, report.activitiesWithoutTimezone());
            assertEquals(1, report.unlinkedAnnotations());
            assertEquals(1, report.activitiesWithMultipleAnnotations());
            assertEquals(0, report.danglingAnnotations());
            assertEquals(2L, report.byProvenance().get("<none>"));
        }
    }
}
