package com.activity.resolution.timezone;

import java.util.List;
import java.util.Map;

/**
 * Result of a timezone backfill or offset recompute run.
 *
 * @param operation       the run's operation name
 * @param considered      activities selected for the run
 * @param updated         activities written, or that would be written in a dry run
 * @param unchanged       activities whose resolved values equal the stored ones
 * @param protectedCount  activities kept because their provenance outranks the new one
 * @param badZones        activities whose zone id could not be resolved
 * @param failed          activities whose write was rolled back
 * @param byZone          planned or written updates per zone id
 * @param byProvenance    planned or written updates per provenance tag
 * @param updates         the planned or written assignments, in activity id order
 * @param dryRun          whether nothing was written
 */
public record TimezoneRunResult(
        String operation,
        long considered,
        long updated,
        long unchanged,
        long protectedCount,
        long badZones,
        long failed,
        Map<String, Long> byZone,
        Map<String, Long> byProvenance,
        List<TimezoneAssignment> updates,
        boolean dryRun
) {
    public TimezoneRunResult {
        byZone = byZone != null ? Map.copyOf(byZone) : Map.of();
        byProvenance = byProvenance != null ? Map.copyOf(byProvenance) : Map.of();
        updates = updates != null ? List.copyOf(updates) : List.of();
    }

    @Override
    public String toString() {
        return "TimezoneRunResult{operation=" + operation +
                ", considered=" + considered +
                ", updated=" + updated +
                ", unchanged=" + unchanged +
                ", protected=" + protectedCount +
                ", badZones=" + badZones +
                ", failed=" + failed +
                ", dryRun=" + dryRun + '}';
    }
}
