package com.activity.resolution.store;

import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.core.model.TimezoneProvenance;
import com.activity.resolution.time.UtcTimestamps;
import com.activity.resolution.timezone.TimezoneAssignment;
import com.activity.resolution.timezone.TimezoneCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for canonical activity rows.
 */
public class ActivityRepository {
    private static final Logger log = LoggerFactory.getLogger(ActivityRepository.class);

    private static final String COLUMNS = """
            a.id, a.start_time_utc, a.end_time_utc, a.elapsed_time_s, a.moving_time_s, a.distance_m,
            a.name, a.sport, a.tz_name, a.utc_offset_minutes, a.tz_source, a.source_quality,
            a.created_at_utc, a.updated_at_utc
            """;

    private final StoreConnection store;

    public ActivityRepository(StoreConnection store) {
        this.store = store;
    }

    /**
     * Inserts an activity and returns its new id.
     */
    public long insert(CanonicalActivity activity) {
        String now = UtcTimestamps.format(Instant.now());
        long id = store.insert("""
                        INSERT INTO activity (
                            start_time_utc, end_time_utc, elapsed_time_s, moving_time_s, distance_m,
                            name, sport, tz_name, utc_offset_minutes, tz_source, source_quality,
                            created_at_utc, updated_at_utc
                        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                UtcTimestamps.format(activity.getStartTimeUtc()),
                UtcTimestamps.format(activity.getEndTimeUtc()),
                activity.getElapsedTimeS(),
                activity.getMovingTimeS(),
                activity.getDistanceM(),
                activity.getName(),
                activity.getSport(),
                activity.getTimezoneName(),
                activity.getUtcOffsetMinutes(),
                activity.getTimezoneProvenance() == null ? null : activity.getTimezoneProvenance().getCode(),
                activity.getSourceQuality(),
                now,
                now);
        log.debug("Inserted activity {} start={}", id, activity.getStartTimeUtc());
        return id;
    }

    public Optional<CanonicalActivity> findById(long id) {
        List<Map<String, Object>> rows = store.query("SELECT " + COLUMNS + " FROM activity a WHERE a.id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToActivity(rows.get(0)));
    }

    public boolean exists(long id) {
        return !store.query("SELECT 1 FROM activity WHERE id = ?", id).isEmpty();
    }

    /**
     * Finds activities whose start lies in the closed interval [from, to].
     */
    public List<CanonicalActivity> findStartingBetween(Instant from, Instant to) {
        return store.query("SELECT " + COLUMNS + """
                         FROM activity a
                        WHERE a.start_time_utc >= ? AND a.start_time_utc <= ?
                        ORDER BY a.start_time_utc, a.id
                        """,
                UtcTimestamps.format(from), UtcTimestamps.format(to)).stream()
                .map(this::mapToActivity)
                .toList();
    }

    /**
     * Finds one page of activities starting in the half-open interval [from, to).
     */
    public List<CanonicalActivity> findStartingInRange(Instant from, Instant to, int offset, int limit) {
        return store.query("SELECT " + COLUMNS + """
                         FROM activity a
                        WHERE a.start_time_utc >= ? AND a.start_time_utc < ?
                        ORDER BY a.start_time_utc, a.id
                        LIMIT ? OFFSET ?
                        """,
                UtcTimestamps.format(from), UtcTimestamps.format(to), limit, offset).stream()
                .map(this::mapToActivity)
                .toList();
    }

    public long countStartingInRange(Instant from, Instant to) {
        List<Map<String, Object>> rows = store.query(
                "SELECT COUNT(*) AS n FROM activity WHERE start_time_utc >= ? AND start_time_utc < ?",
                UtcTimestamps.format(from), UtcTimestamps.format(to));
        return Rows.longValue(rows.get(0), "n");
    }

    /**
     * Finds activities annotated as training, the population of the duplicate detector.
     */
    public List<CanonicalActivity> findTrainingActivities() {
        return store.query("SELECT " + COLUMNS + """
                         FROM activity a
                        WHERE EXISTS (
                            SELECT 1 FROM training_log_data t
                             WHERE t.canonical_activity_id = a.id AND t.is_training = 1)
                        ORDER BY a.start_time_utc, a.id
                        """).stream()
                .map(this::mapToActivity)
                .toList();
    }

    /**
     * Loads timezone backfill input: every activity (or only those without a zone)
     * with the payload of its first GPS source row.
     */
    public List<TimezoneCandidate> findTimezoneCandidates(boolean onlyMissing) {
        return store.query("""
                        SELECT a.id, a.start_time_utc, a.sport, a.tz_name, a.utc_offset_minutes, a.tz_source,
                               s.source_activity_id AS gps_native_id, g.data AS gps_payload
                          FROM activity a
                          LEFT JOIN activity_source s
                            ON s.id = (SELECT MIN(s2.id) FROM activity_source s2
                                        WHERE s2.activity_id = a.id AND s2.source = 'strava')
                          LEFT JOIN strava_activity g
                            ON CAST(g.activity_id AS TEXT) =
                               CASE WHEN s.source_activity_id LIKE 'activity-%'
                                    THEN substr(s.source_activity_id, 10)
                                    ELSE s.source_activity_id END
                         WHERE ? = 0 OR a.tz_name IS NULL OR trim(a.tz_name) = ''
                         ORDER BY a.id
                        """,
                onlyMissing ? 1 : 0).stream()
                .map(this::mapToCandidate)
                .toList();
    }

    /**
     * Loads activities that have a zone; with {@code onlyMissingOffset} only those without an offset.
     */
    public List<TimezoneCandidate> findOffsetCandidates(boolean onlyMissingOffset) {
        return store.query("""
                        SELECT a.id, a.start_time_utc, a.sport, a.tz_name, a.utc_offset_minutes, a.tz_source,
                               NULL AS gps_native_id, NULL AS gps_payload
                          FROM activity a
                         WHERE a.tz_name IS NOT NULL AND trim(a.tz_name) <> ''
                           AND (? = 0 OR a.utc_offset_minutes IS NULL)
                         ORDER BY a.id
                        """,
                onlyMissingOffset ? 1 : 0).stream()
                .map(this::mapToCandidate)
                .toList();
    }

    public int updateTimezone(TimezoneAssignment assignment) {
        return store.execute("""
                        UPDATE activity
                           SET tz_name = ?, utc_offset_minutes = ?, tz_source = ?, updated_at_utc = ?
                         WHERE id = ?
                        """,
                assignment.timezoneName(),
                assignment.utcOffsetMinutes(),
                assignment.provenance().getCode(),
                UtcTimestamps.format(Instant.now()),
                assignment.activityId());
    }

    public int delete(long id) {
        return store.execute("DELETE FROM activity WHERE id = ?", id);
    }

    /**
     * Source coverage per activity: how many GPS and desktop links each has.
     */
    public List<SourceCoverage> findSourceCoverage() {
        return store.query("""
                SELECT a.id, a.start_time_utc, a.distance_m,
                       SUM(CASE WHEN s.source = 'strava' THEN 1 ELSE 0 END) AS gps_links,
                       SUM(CASE WHEN s.source = 'sporttracks' THEN 1 ELSE 0 END) AS desktop_links
                  FROM activity a
                  LEFT JOIN activity_source s ON s.activity_id = a.id
                 GROUP BY a.id, a.start_time_utc, a.distance_m
                 ORDER BY a.start_time_utc, a.id
                """).stream()
                .map(row -> new SourceCoverage(
                        Rows.longValue(row, "id"),
                        Rows.instant(row, "start_time_utc"),
                        Rows.doubleValue(row, "distance_m"),
                        Rows.longValue(row, "gps_links"),
                        Rows.longValue(row, "desktop_links")))
                .toList();
    }

    public long count() {
        return Rows.longValue(store.query("SELECT COUNT(*) AS n FROM activity").get(0), "n");
    }

    public long countWithoutSources() {
        return Rows.longValue(store.query("""
                SELECT COUNT(*) AS n FROM activity a
                 WHERE NOT EXISTS (SELECT 1 FROM activity_source s WHERE s.activity_id = a.id)
                """).get(0), "n");
    }

    public long countWithoutTimezone() {
        return Rows.longValue(store.query(
                "SELECT COUNT(*) AS n FROM activity WHERE tz_name IS NULL OR trim(tz_name) = ''").get(0), "n");
    }

    /**
     * Counts activities per stored provenance tag; untagged rows are keyed {@code <none>}.
     */
    public Map<String, Long> countByProvenance() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : store.query("""
                SELECT COALESCE(tz_source, '<none>') AS tz_source, COUNT(*) AS n
                  FROM activity
                 GROUP BY COALESCE(tz_source, '<none>')
                 ORDER BY n DESC, tz_source
                """)) {
            counts.put(Rows.text(row, "tz_source"), Rows.longValue(row, "n"));
        }
        return counts;
    }

    private CanonicalActivity mapToActivity(Map<String, Object> row) {
        return CanonicalActivity.builder()
                .id(Rows.longValue(row, "id"))
                .startTimeUtc(Rows.instant(row, "start_time_utc"))
                .endTimeUtc(Rows.instant(row, "end_time_utc"))
                .elapsedTimeS(Rows.longValue(row, "elapsed_time_s"))
                .movingTimeS(Rows.longValue(row, "moving_time_s"))
                .distanceM(Rows.doubleValue(row, "distance_m"))
                .name(Rows.text(row, "name"))
                .sport(Rows.text(row, "sport"))
                .timezoneName(Rows.text(row, "tz_name"))
                .utcOffsetMinutes(Rows.intValue(row, "utc_offset_minutes"))
                .timezoneProvenance(TimezoneProvenance.fromCode(Rows.text(row, "tz_source")))
                .sourceQuality(Rows.intValue(row, "source_quality") == null ? 0 : Rows.intValue(row, "source_quality"))
                .createdAt(Rows.instant(row, "created_at_utc"))
                .updatedAt(Rows.instant(row, "updated_at_utc"))
                .build();
    }

    private TimezoneCandidate mapToCandidate(Map<String, Object> row) {
        return new TimezoneCandidate(
                Rows.longValue(row, "id"),
                Rows.instant(row, "start_time_utc"),
                Rows.text(row, "sport"),
                Rows.text(row, "tz_name"),
                Rows.intValue(row, "utc_offset_minutes"),
                TimezoneProvenance.fromCode(Rows.text(row, "tz_source")),
                Rows.text(row, "gps_native_id"),
                Rows.text(row, "gps_payload"));
    }

    /**
     * Number of links per source system for one activity.
     */
    public record SourceCoverage(long activityId, Instant startTimeUtc, Double distanceM,
                                 long gpsLinks, long desktopLinks) {

        public boolean isGpsOnly() {
            return gpsLinks > 0 && desktopLinks == 0;
        }

        public boolean isDesktopOnly() {
            return desktopLinks > 0 && gpsLinks == 0;
        }
    }
}
