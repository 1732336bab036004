package com.activity.resolution.api;

import com.activity.resolution.category.CategoryPathCache;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.metrics.NoOpMetricsService;
import com.activity.resolution.store.CategoryRepository;
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

@DisplayName("ActivityQueryService Tests")
class ActivityQueryServiceTest {

    @TempDir
    Path tempDir;

    private TestDatabase db;
    private ActivityQueryService queries;
    private long morning;
    private long evening;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create(tempDir);
        queries = new ActivityQueryService(db.store(),
                new CategoryPathCache(new CategoryRepository(db.store()), new NoOpMetricsService(), 100));

        db.category(1, null, "Run");
        db.category(2, 1L, "Tempo");
        morning = db.activity("2024-06-01T12:00:00Z", 3600, 10000.0, "Run");
        db.link(morning, SourceSystem.GPS_PLATFORM, "activity-100");
        db.link(morning, SourceSystem.DESKTOP_LOG, "7");
        db.annotation("st-7", 2L, true, morning);
        evening = db.activity("2024-06-01T22:00:00Z", 1800, 5000.0, "Ride");
        db.activity("2024-06-03T12:00:00Z", 1800, 5000.0, "Ride");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Nested
    @DisplayName("Range queries")
    class Range {

        @Test
        @DisplayName("Lists activities in the half-open range with their annotation")
        void inRange() {
            Page<ActivitySummary> page = queries.findInRange(Instant.parse("2024-06-01T00:00:00Z"),
                    Instant.parse("2024-06-02T00:00:00Z"), PageRequest.of(0, 10));

            assertEquals(2, page.totalElements());
            ActivitySummary first = page.content().get(0);
            assertEquals(morning, first.activity().getId());
            assertEquals("st-7", first.annotationNativeId());
            assertEquals("Run : Tempo", first.categoryPath());
            assertTrue(first.training());
            assertNull(page.content().get(1).annotationNativeId());
        }

        @Test
        @DisplayName("Pages follow start order and the end bound is exclusive")
        void paging() {
            Page<ActivitySummary> second = queries.findInRange(Instant.parse("2024-06-01T00:00:00Z"),
                    Instant.parse("2024-06-03T12:00:00Z"), PageRequest.of(1, 1));

            assertEquals(2, second.totalElements());
            assertEquals(evening, second.content().get(0).activity().getId());
            assertFalse(second.hasNext());
        }

        @Test
        @DisplayName("Empty or inverted ranges")
        void emptyRanges() {
            assertTrue(queries.findInRange(Instant.parse("2025-01-01T00:00:00Z"),
                    Instant.parse("2025-01-02T00:00:00Z"), PageRequest.of(0, 10)).content().isEmpty());
            assertThrows(IllegalArgumentException.class, () -> queries.findInRange(
                    Instant.parse("2024-06-02T00:00:00Z"), Instant.parse("2024-06-01T00:00:00Z"),
                    PageRequest.of(0, 10)));
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("Detail carries sources, annotations and category path")
        void detail() {
            ActivityDetail detail = queries.findById(morning).orElseThrow();

            assertEquals(2, detail.sources().size());
            assertEquals(1, detail.annotations().size());
            assertEquals("Run : Tempo", detail.categoryPath());
            assertTrue(queries.findById(9999L).isEmpty());
        }

        @Test
        @DisplayName("GPS ids resolve with or without the annotation prefix")
        void bySource() {
            assertEquals(Optional.of(morning), queries.findCanonicalIdBySource(SourceSystem.GPS_PLATFORM, "100"));
            assertEquals(Optional.of(morning),
                    queries.findCanonicalIdBySource(SourceSystem.GPS_PLATFORM, "activity-100"));
            assertEquals(Optional.of(morning), queries.findCanonicalIdBySource(SourceSystem.DESKTOP_LOG, "7"));
            assertTrue(queries.findCanonicalIdBySource(SourceSystem.DESKTOP_LOG, "8").isEmpty());
        }

        @Test
        @DisplayName("Native ids come back in annotation form")
        void nativeIds() {
            List<String> ids = queries.findNativeIds(morning);

            assertEquals(2, ids.size());
            assertTrue(ids.contains("activity-100"));
            assertTrue(ids.contains("st-7"));
            assertEquals(Optional.of(morning), queries.findCanonicalIdByAnnotation("st-7"));
            assertTrue(queries.findCanonicalIdByAnnotation("st-404").isEmpty());
        }
    }
}
