package com.activity.resolution.store;

import com.activity.resolution.core.model.SecondaryAnnotation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for {@code training_log_data} annotations. Only the canonical reference is ever written.
 */
public class AnnotationRepository {

    private static final String COLUMNS = """
            activity_id, category_id, workout_type_id, notes, tags, is_training, canonical_activity_id
            """;

    private final StoreConnection store;

    public AnnotationRepository(StoreConnection store) {
        this.store = store;
    }

    public Optional<SecondaryAnnotation> findByNativeId(String nativeId) {
        List<Map<String, Object>> rows = store.query(
                "SELECT " + COLUMNS + " FROM training_log_data WHERE activity_id = ?", nativeId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToAnnotation(rows.get(0)));
    }

    /**
     * Finds the annotations referencing an activity, ordered by native id.
     */
    public List<SecondaryAnnotation> findByCanonical(long activityId) {
        return store.query("SELECT " + COLUMNS
                                + " FROM training_log_data WHERE canonical_activity_id = ? ORDER BY activity_id",
                        activityId).stream()
                .map(this::mapToAnnotation)
                .toList();
    }

    /**
     * Activities referenced by more than one annotation, ascending.
     */
    public List<Long> findCanonicalIdsWithMultipleAnnotations() {
        return store.query("""
                SELECT canonical_activity_id AS id
                  FROM training_log_data
                 WHERE canonical_activity_id IS NOT NULL
                 GROUP BY canonical_activity_id
                HAVING COUNT(*) > 1
                 ORDER BY canonical_activity_id
                """).stream()
                .map(row -> Rows.longValue(row, "id"))
                .toList();
    }

    /**
     * Sets the canonical reference of an annotation that has none.
     *
     * @return 1 if the annotation was linked, 0 if it was missing or already linked
     */
    public int linkIfUnlinked(String nativeId, long activityId) {
        return store.execute("""
                        UPDATE training_log_data SET canonical_activity_id = ?
                         WHERE activity_id = ? AND canonical_activity_id IS NULL
                        """,
                activityId, nativeId);
    }

    /**
     * Clears the canonical reference. The annotation itself is kept.
     */
    public int unlink(String nativeId) {
        return store.execute("UPDATE training_log_data SET canonical_activity_id = NULL WHERE activity_id = ?",
                nativeId);
    }

    public int repoint(long fromActivityId, long toActivityId) {
        return store.execute("UPDATE training_log_data SET canonical_activity_id = ? WHERE canonical_activity_id = ?",
                toActivityId, fromActivityId);
    }

    public long countByCanonical(long activityId) {
        return Rows.longValue(store.query(
                "SELECT COUNT(*) AS n FROM training_log_data WHERE canonical_activity_id = ?", activityId).get(0), "n");
    }

    public long countDangling() {
        return Rows.longValue(store.query("""
                SELECT COUNT(*) AS n FROM training_log_data t
                 WHERE t.canonical_activity_id IS NOT NULL
                   AND NOT EXISTS (SELECT 1 FROM activity a WHERE a.id = t.canonical_activity_id)
                """).get(0), "n");
    }

    public long countUnlinked() {
        return Rows.longValue(store.query(
                "SELECT COUNT(*) AS n FROM training_log_data WHERE canonical_activity_id IS NULL").get(0), "n");
    }

    private SecondaryAnnotation mapToAnnotation(Map<String, Object> row) {
        return new SecondaryAnnotation(
                Rows.text(row, "activity_id"),
                Rows.longValue(row, "category_id"),
                Rows.longValue(row, "workout_type_id"),
                Rows.text(row, "notes"),
                Rows.text(row, "tags"),
                Rows.flag(row, "is_training"),
                Rows.longValue(row, "canonical_activity_id"));
    }
}
