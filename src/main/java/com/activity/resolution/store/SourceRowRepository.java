package com.activity.resolution.store;

import com.activity.resolution.core.model.DesktopSourceRow;
import com.activity.resolution.core.model.GpsSourceRow;

import java.util.List;

/**
 * Reads native source rows that have no link yet. The anti-join runs in the store
 * so already-ingested rows never reach the ingestor.
 */
public class SourceRowRepository {

    private final StoreConnection store;

    public SourceRowRepository(StoreConnection store) {
        this.store = store;
    }

    public List<GpsSourceRow> findUnlinkedGpsRows() {
        return store.query("""
                SELECT CAST(g.activity_id AS TEXT) AS activity_id, g.start_date_time, g.sport_type,
                       g.distance, g.moving_time_s, g.name, g.data
                  FROM strava_activity g
                  LEFT JOIN activity_source s
                    ON s.source = 'strava'
                   AND (s.source_activity_id = CAST(g.activity_id AS TEXT)
                        OR s.source_activity_id = 'activity-' || CAST(g.activity_id AS TEXT))
                 WHERE s.id IS NULL
                 ORDER BY g.start_date_time, g.activity_id
                """).stream()
                .map(row -> new GpsSourceRow(
                        Rows.text(row, "activity_id"),
                        Rows.text(row, "start_date_time"),
                        Rows.text(row, "sport_type"),
                        Rows.text(row, "distance"),
                        Rows.text(row, "moving_time_s"),
                        Rows.text(row, "name"),
                        Rows.text(row, "data")))
                .toList();
    }

    public List<DesktopSourceRow> findUnlinkedDesktopRows() {
        return store.query("""
                SELECT CAST(d.activity_id AS TEXT) AS activity_id, d.start_date, d.start_time,
                       d.distance_m, d.duration_s, d.category, d.notes, d.name
                  FROM sporttracks_activity d
                  LEFT JOIN activity_source s
                    ON s.source = 'sporttracks' AND s.source_activity_id = CAST(d.activity_id AS TEXT)
                 WHERE s.id IS NULL
                 ORDER BY d.start_date, d.start_time, d.activity_id
                """).stream()
                .map(row -> new DesktopSourceRow(
                        Rows.text(row, "activity_id"),
                        Rows.text(row, "start_date"),
                        Rows.text(row, "start_time"),
                        Rows.text(row, "distance_m"),
                        Rows.text(row, "duration_s"),
                        Rows.text(row, "category"),
                        Rows.text(row, "notes"),
                        Rows.text(row, "name")))
                .toList();
    }
}
