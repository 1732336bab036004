package com.activity.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only in-memory audit trail of store mutations for the lifetime of the engine.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditAction action, Long activityId, String runId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.of(action, activityId, runId, details);
        entries.add(entry);
        log.debug("audit.recorded action={} activityId={} runId={}", action, activityId, runId);
        return entry;
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> getEntriesForActivity(long activityId) {
        return entries.stream()
                .filter(e -> e.activityId() != null && e.activityId() == activityId)
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return entries.stream()
                .filter(e -> runId.equals(e.runId()))
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
