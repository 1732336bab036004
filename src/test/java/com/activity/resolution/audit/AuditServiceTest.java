package com.activity.resolution.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditService Tests")
class AuditServiceTest {

    private AuditService audit;

    @BeforeEach
    void setUp() {
        audit = new AuditService();
    }

    @Test
    @DisplayName("Records entries with id and timestamp")
    void records() {
        AuditEntry entry = audit.record(AuditAction.ACTIVITY_CREATED, 7L, "run-1", Map.of("nativeId", "100"));

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals("100", entry.details().get("nativeId"));
        assertEquals(1, audit.size());
    }

    @Test
    @DisplayName("Filters by activity, action and run")
    void filters() {
        audit.record(AuditAction.ACTIVITY_CREATED, 1L, "run-1", Map.of());
        audit.record(AuditAction.SOURCE_LINKED, 1L, "run-1", Map.of());
        audit.record(AuditAction.ACTIVITIES_MERGED, 2L, "run-2", Map.of("dropId", 1L));

        assertEquals(2, audit.getEntriesForActivity(1L).size());
        assertEquals(1, audit.getEntriesByAction(AuditAction.ACTIVITIES_MERGED).size());
        assertEquals(2, audit.getEntriesForRun("run-1").size());
        assertTrue(audit.getEntriesForRun("run-3").isEmpty());
        assertEquals(3, audit.getAllEntries().size());
    }

    @Test
    @DisplayName("Entries are immutable snapshots")
    void immutable() {
        Map<String, Object> details = new HashMap<>();
        details.put("zone", "America/Denver");
        AuditEntry entry = audit.record(AuditAction.TIMEZONE_ASSIGNED, 3L, "run-1", details);
        details.put("zone", "UTC");

        assertEquals("America/Denver", entry.details().get("zone"));
        List<AuditEntry> all = audit.getAllEntries();
        assertThrows(UnsupportedOperationException.class, () -> all.add(entry));
    }

    @Test
    @DisplayName("Null details become empty")
    void nullDetails() {
        AuditEntry entry = audit.record(AuditAction.ANNOTATION_LINKED, null, "run-1", null);

        assertTrue(entry.details().isEmpty());
        assertTrue(audit.getEntriesForActivity(0L).isEmpty());
    }
}
