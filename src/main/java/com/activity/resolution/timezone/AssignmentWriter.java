package com.activity.resolution.timezone;

import com.activity.resolution.audit.AuditAction;
import com.activity.resolution.audit.AuditService;
import com.activity.resolution.core.exception.ConsistencyException;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.StoreConnection;
import com.activity.resolution.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized writer for timezone assignments: one transaction per chunk.
 * A failing chunk is rolled back and counted; later chunks still run.
 */
class AssignmentWriter {
    private static final Logger log = LoggerFactory.getLogger(AssignmentWriter.class);

    static final int DEFAULT_CHUNK_SIZE = 500;

    private final StoreConnection store;
    private final ActivityRepository activities;
    private final MetricsService metrics;
    private final AuditService audit;
    private final int chunkSize;

    AssignmentWriter(StoreConnection store, MetricsService metrics, AuditService audit, int chunkSize) {
        this.store = store;
        this.activities = new ActivityRepository(store);
        this.metrics = metrics;
        this.audit = audit;
        this.chunkSize = chunkSize;
    }

    /**
     * Writes the assignments.
     *
     * @param previous stored values keyed by activity id, for the audit trail
     * @return number of assignments rolled back
     */
    long write(List<TimezoneAssignment> assignments, Map<Long, TimezoneCandidate> previous,
               AuditAction action, String runId) {
        long failed = 0;
        for (int from = 0; from < assignments.size(); from += chunkSize) {
            List<TimezoneAssignment> chunk = assignments.subList(from, Math.min(from + chunkSize, assignments.size()));
            try (StoreTransaction tx = store.begin()) {
                for (TimezoneAssignment assignment : chunk) {
                    activities.updateTimezone(assignment);
                }
                tx.markSuccess();
            } catch (ConsistencyException e) {
                log.error("timezone.chunk.failed firstActivityId={} size={} reason={}",
                        chunk.get(0).activityId(), chunk.size(), e.getMessage());
                failed += chunk.size();
                continue;
            }
            for (TimezoneAssignment assignment : chunk) {
                metrics.incrementTimezoneAssigned(assignment.provenance());
                audit.record(action, assignment.activityId(), runId, details(assignment, previous.get(assignment.activityId())));
            }
        }
        return failed;
    }

    private static Map<String, Object> details(TimezoneAssignment assignment, TimezoneCandidate before) {
        Map<String, Object> details = new HashMap<>();
        details.put("tzName", assignment.timezoneName());
        details.put("provenance", assignment.provenance().getCode());
        if (assignment.utcOffsetMinutes() != null) {
            details.put("offsetMinutes", assignment.utcOffsetMinutes());
        }
        if (before != null && before.currentTimezoneName() != null) {
            details.put("previousTzName", before.currentTimezoneName());
        }
        return details;
    }
}
