package com.activity.resolution.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one store mutation.
 *
 * @param id         unique entry id
 * @param action     what happened
 * @param activityId the canonical activity affected
 * @param runId      the batch run that made the change
 * @param details    action-specific values such as native ids or old and new zones
 * @param timestamp  when it happened
 */
public record AuditEntry(
        String id,
        AuditAction action,
        Long activityId,
        String runId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry of(AuditAction action, Long activityId, String runId, Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, activityId, runId, details, Instant.now());
    }
}
