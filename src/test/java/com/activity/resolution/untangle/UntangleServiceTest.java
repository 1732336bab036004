package com.activity.resolution.untangle;

import com.activity.resolution.audit.AuditAction;
import com.activity.resolution.audit.AuditEntry;
import com.activity.resolution.audit.AuditService;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.core.run.OnlyFilter;
import com.activity.resolution.core.run.RunOptions;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.testing.TestDatabase;
import com.activity.resolution.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("UntangleService Tests")
class UntangleServiceTest {

    @TempDir
    Path tempDir;

    private TestDatabase db;
    private AuditService audit;
    private MetricsService metrics;
    private UntangleService service;
    private long tangled;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create(tempDir);
        audit = new AuditService();
        metrics = mock(MetricsService.class);
        service = new UntangleService(db.store(), new LinkUntangler(), metrics, new NoOpTracingService(), audit);

        tangled = db.activity("2024-06-01T12:00:00Z", 3600, 10000.0, "Run");
        db.link(tangled, SourceSystem.DESKTOP_LOG, "3");
        db.annotation("st-3", 4L, true, tangled);
        db.annotation("st-2", 5L, true, tangled);
        db.annotation("activity-77", 6L, true, tangled);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Nested
    @DisplayName("Applying decisions")
    class Apply {

        @Test
        @DisplayName("Extra annotations are unlinked but kept")
        void unlinksExtras() {
            UntangleResult result = service.untangle(RunOptions.defaults());

            assertEquals(1, result.considered());
            assertEquals(1, result.applied());
            assertEquals(2, result.unlinked());
            assertEquals(tangled, db.canonicalOf("st-3"));
            assertNull(db.canonicalOf("st-2"));
            assertNull(db.canonicalOf("activity-77"));
            assertEquals(3, db.count("training_log_data"));
            verify(metrics).incrementAnnotationsUnlinked(2);

            List<AuditEntry> entries = audit.getEntriesByAction(AuditAction.ANNOTATION_UNLINKED);
            assertEquals(1, entries.size());
            assertEquals("st-3", entries.get(0).details().get("kept"));
        }

        @Test
        @DisplayName("Second run has nothing to do")
        void idempotent() {
            service.untangle(RunOptions.defaults());

            UntangleResult second = service.untangle(RunOptions.defaults());

            assertEquals(0, second.considered());
        }

        @Test
        @DisplayName("Dry run reports without writing")
        void dryRun() {
            UntangleResult result = service.untangle(RunOptions.builder().dryRun(true).build());

            assertTrue(result.dryRun());
            assertEquals(0, result.applied());
            assertEquals(2, result.unlinked());
            assertEquals(tangled, db.canonicalOf("st-2"));
            assertEquals(0, audit.size());
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Canonical filter excludes other activities")
        void canonicalFilter() {
            long other = db.activity("2024-06-02T12:00:00Z", 3600, 10000.0, "Run");
            db.annotation("st-8", null, true, other);
            db.annotation("st-9", null, true, other);

            List<UntangleRecommendation> plan = service.plan(RunOptions.builder()
                    .only(OnlyFilter.parse("canonical=" + other))
                    .build());

            assertEquals(1, plan.size());
            assertEquals(other, plan.get(0).activityId());
            assertEquals("st-8", plan.get(0).keepNativeId());
        }

        @Test
        @DisplayName("Id filter matches any annotation of the activity")
        void idFilter() {
            assertEquals(1, service.plan(RunOptions.builder().only(OnlyFilter.parse("id=st-2")).build()).size());
            assertEquals(0, service.plan(RunOptions.builder().only(OnlyFilter.parse("id=st-404")).build()).size());
        }
    }
}
