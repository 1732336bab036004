package com.activity.resolution.duplicate;

import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.metrics.NoOpMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("DuplicateClusterDetector Tests")
class DuplicateClusterDetectorTest {

    private static final Instant BASE = Instant.parse("2024-06-01T10:00:00Z");

    private final DuplicateClusterDetector detector =
            new DuplicateClusterDetector(DetectorOptions.defaults(), new NoOpMetricsService());

    private static CanonicalActivity activity(long id, long startMinutes, long durationMinutes) {
        return CanonicalActivity.builder()
                .id(id)
                .startTimeUtc(BASE.plus(Duration.ofMinutes(startMinutes)))
                .elapsedTimeS(durationMinutes * 60)
                .sport("Run")
                .distanceM(10000.0)
                .name("run " + id)
                .build();
    }

    @Nested
    @DisplayName("Clustering")
    class Clustering {

        @Test
        @DisplayName("Chained overlaps form one cluster even when the ends do not overlap")
        void transitiveCluster() {
            CanonicalActivity a = activity(1, 0, 60);
            CanonicalActivity b = activity(2, 50, 60);
            CanonicalActivity c = activity(3, 100, 60);

            DuplicateReport report = detector.detect(List.of(c, a, b));

            assertEquals(2, report.pairs().size());
            assertEquals(1, report.clusters().size());
            assertEquals(List.of(1L, 2L, 3L), report.clusters().get(0).ids());
        }

        @Test
        @DisplayName("Disjoint activities form no cluster")
        void disjoint() {
            DuplicateReport report = detector.detect(List.of(activity(1, 0, 60), activity(2, 60, 60)));

            assertTrue(report.pairs().isEmpty());
            assertTrue(report.clusters().isEmpty());
            assertEquals(2, report.examined());
        }

        @Test
        @DisplayName("Larger clusters come first")
        void clusterOrder() {
            DuplicateReport report = detector.detect(List.of(
                    activity(10, 0, 60), activity(11, 5, 60),
                    activity(20, 500, 60), activity(21, 505, 60), activity(22, 510, 60)));

            assertEquals(2, report.clusters().size());
            assertEquals(List.of(20L, 21L, 22L), report.clusters().get(0).ids());
            assertEquals(List.of(10L, 11L), report.clusters().get(1).ids());
        }

        @Test
        @DisplayName("Cluster sizes are recorded")
        void metrics() {
            MetricsService metrics = mock(MetricsService.class);
            new DuplicateClusterDetector(DetectorOptions.defaults(), metrics)
                    .detect(List.of(activity(1, 0, 60), activity(2, 10, 60)));
            verify(metrics).recordClusterSize(2);
        }
    }

    @Nested
    @DisplayName("Pairs")
    class Pairs {

        @Test
        @DisplayName("Largest overlap is reported first")
        void reportOrder() {
            DuplicateReport report = detector.detect(List.of(
                    activity(1, 0, 60), activity(2, 55, 60), activity(3, 200, 60), activity(4, 201, 60)));

            assertEquals(2, report.pairs().size());
            OverlapPair first = report.pairs().get(0);
            assertEquals(3L, first.first().activityId());
            assertEquals(4L, first.second().activityId());
            assertEquals(59 * 60, first.overlapSeconds());
            assertEquals(5 * 60, report.pairs().get(1).overlapSeconds());
        }

        @Test
        @DisplayName("Overlaps shorter than the minimum are ignored")
        void minOverlap() {
            DuplicateReport report = detector.detect(List.of(
                    activity(1, 0, 60), CanonicalActivity.builder()
                            .id(2L)
                            .startTimeUtc(BASE.plusSeconds(3570))
                            .elapsedTimeS(600L)
                            .build()));

            assertTrue(report.pairs().isEmpty());
        }

        @Test
        @DisplayName("Tolerance widens both intervals")
        void tolerance() {
            DuplicateClusterDetector widened = new DuplicateClusterDetector(DetectorOptions.builder()
                    .tolerance(Duration.ofMinutes(2))
                    .build(), new NoOpMetricsService());

            DuplicateReport report = widened.detect(List.of(activity(1, 0, 60), activity(2, 62, 30)));

            assertEquals(1, report.pairs().size());
            assertEquals(120, report.pairs().get(0).overlapSeconds());
        }

        @Test
        @DisplayName("Contained activity overlaps for its whole length")
        void contained() {
            DuplicateReport report = detector.detect(List.of(activity(1, 0, 120), activity(2, 30, 20)));

            assertEquals(20 * 60, report.pairs().get(0).overlapSeconds());
        }
    }

    @Nested
    @DisplayName("Exclusions")
    class Exclusions {

        @Test
        @DisplayName("Activities without a positive interval are excluded and listed")
        void excluded() {
            CanonicalActivity noEnd = CanonicalActivity.builder().id(5L).startTimeUtc(BASE).build();
            CanonicalActivity zero = CanonicalActivity.builder().id(6L).startTimeUtc(BASE).elapsedTimeS(0L).build();

            DuplicateReport report = detector.detect(List.of(noEnd, zero, activity(7, 0, 60)));

            assertEquals(1, report.examined());
            assertEquals(List.of(5L, 6L), report.excluded());
        }

        @Test
        @DisplayName("Negative options are rejected")
        void options() {
            assertThrows(IllegalArgumentException.class,
                    () -> DetectorOptions.builder().minOverlap(Duration.ofSeconds(-1)));
            assertThrows(IllegalArgumentException.class,
                    () -> DetectorOptions.builder().tolerance(Duration.ofSeconds(-1)));
        }
    }

    @Nested
    @DisplayName("CSV output")
    class Csv {

        @Test
        @DisplayName("One row per pair with quoted names")
        void writesRows() throws IOException {
            CanonicalActivity a = CanonicalActivity.builder().id(1L).startTimeUtc(BASE).elapsedTimeS(3600L)
                    .sport("Run").distanceM(10000.0).name("Easy, recovery").build();
            CanonicalActivity b = CanonicalActivity.builder().id(2L).startTimeUtc(BASE.plusSeconds(60))
                    .elapsedTimeS(3600L).sport("Run").name("Run \"2\"").build();
            DuplicateReport report = detector.detect(List.of(a, b));

            StringWriter out = new StringWriter();
            new OverlapPairCsvWriter().write(report.pairs(), out);

            String[] lines = out.toString().split("\\R");
            assertEquals(2, lines.length);
            assertEquals(OverlapPairCsvWriter.HEADER, lines[0]);
            assertEquals("3540,1,2024-06-01T10:00:00Z,2024-06-01T11:00:00Z,Run,10000.0,\"Easy, recovery\","
                    + "2,2024-06-01T10:01:00Z,2024-06-01T11:01:00Z,Run,,\"Run \"\"2\"\"\"", lines[1]);
        }
    }
}
