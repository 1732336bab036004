package com.activity.resolution.store;

import com.activity.resolution.core.model.MatchTier;
import com.activity.resolution.core.model.SourceLink;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.time.UtcTimestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for {@code activity_source} rows.
 */
public class SourceLinkRepository {
    private static final Logger log = LoggerFactory.getLogger(SourceLinkRepository.class);

    private static final String COLUMNS = """
            id, activity_id, source, source_activity_id, start_time_utc, start_time_local,
            elapsed_time_s, distance_m, sport, payload_hash, match_confidence, ingested_at_utc
            """;

    private final StoreConnection store;

    public SourceLinkRepository(StoreConnection store) {
        this.store = store;
    }

    public long insert(SourceLink link) {
        long id = store.insert("""
                        INSERT INTO activity_source (
                            activity_id, source, source_activity_id, start_time_utc, start_time_local,
                            elapsed_time_s, distance_m, sport, payload_hash, match_confidence, ingested_at_utc
                        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                link.canonicalActivityId(),
                link.sourceSystem().getCode(),
                link.sourceNativeId(),
                UtcTimestamps.format(link.startTimeUtc()),
                link.startTimeLocal(),
                link.durationS(),
                link.distanceM(),
                link.sport(),
                link.payloadHash(),
                link.matchTier().getCode(),
                UtcTimestamps.format(link.ingestedAt() != null ? link.ingestedAt() : Instant.now()));
        log.debug("Linked {} {} to activity {} tier={}", link.sourceSystem().getCode(),
                link.sourceNativeId(), link.canonicalActivityId(), link.matchTier().getCode());
        return id;
    }

    public List<SourceLink> findByActivity(long activityId) {
        return store.query("SELECT " + COLUMNS + " FROM activity_source WHERE activity_id = ? ORDER BY id",
                        activityId).stream()
                .map(this::mapToLink)
                .toList();
    }

    public Optional<SourceLink> findByNative(SourceSystem sourceSystem, String sourceNativeId) {
        List<Map<String, Object>> rows = store.query(
                "SELECT " + COLUMNS + " FROM activity_source WHERE source = ? AND source_activity_id = ?",
                sourceSystem.getCode(), sourceNativeId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToLink(rows.get(0)));
    }

    /**
     * Moves every link of one activity to another.
     *
     * @return number of links moved
     */
    public int repoint(long fromActivityId, long toActivityId) {
        return store.execute("UPDATE activity_source SET activity_id = ? WHERE activity_id = ?",
                toActivityId, fromActivityId);
    }

    public long countByActivity(long activityId) {
        return Rows.longValue(store.query(
                "SELECT COUNT(*) AS n FROM activity_source WHERE activity_id = ?", activityId).get(0), "n");
    }

    public long count() {
        return Rows.longValue(store.query("SELECT COUNT(*) AS n FROM activity_source").get(0), "n");
    }

    /**
     * Counts links whose activity no longer exists. Non-zero only in stores written
     * without foreign key enforcement.
     */
    public long countOrphans() {
        return Rows.longValue(store.query("""
                SELECT COUNT(*) AS n FROM activity_source s
                 WHERE NOT EXISTS (SELECT 1 FROM activity a WHERE a.id = s.activity_id)
                """).get(0), "n");
    }

    /**
     * Counts links whose source row is gone from the native table.
     */
    public long countMissingNativeRows() {
        return Rows.longValue(store.query("""
                SELECT COUNT(*) AS n FROM activity_source s
                 WHERE (s.source = 'strava' AND NOT EXISTS (
                           SELECT 1 FROM strava_activity g
                            WHERE CAST(g.activity_id AS TEXT) =
                                  CASE WHEN s.source_activity_id LIKE 'activity-%'
                                       THEN substr(s.source_activity_id, 10)
                                       ELSE s.source_activity_id END))
                    OR (s.source = 'sporttracks' AND NOT EXISTS (
                           SELECT 1 FROM sporttracks_activity d
                            WHERE CAST(d.activity_id AS TEXT) = s.source_activity_id))
                """).get(0), "n");
    }

    private SourceLink mapToLink(Map<String, Object> row) {
        SourceSystem system = SourceSystem.fromCode(Rows.text(row, "source"))
                .orElseThrow(() -> new IllegalStateException("Unknown source " + row.get("source")));
        return new SourceLink(
                Rows.longValue(row, "id"),
                Rows.longValue(row, "activity_id"),
                system,
                Rows.text(row, "source_activity_id"),
                Rows.instant(row, "start_time_utc"),
                Rows.text(row, "start_time_local"),
                Rows.doubleValue(row, "distance_m"),
                Rows.longValue(row, "elapsed_time_s"),
                Rows.text(row, "sport"),
                Rows.text(row, "payload_hash"),
                MatchTier.fromCode(Rows.text(row, "match_confidence")).orElse(MatchTier.NEW),
                Rows.instant(row, "ingested_at_utc"));
    }
}
