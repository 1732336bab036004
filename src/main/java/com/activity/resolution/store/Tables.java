package com.activity.resolution.store;

import java.util.List;
import java.util.Map;

/**
 * Table names and the columns this engine reads or writes in each.
 */
public final class Tables {

    public static final String ACTIVITY = "activity";
    public static final String ACTIVITY_SOURCE = "activity_source";
    public static final String GPS_ACTIVITY = "strava_activity";
    public static final String DESKTOP_ACTIVITY = "sporttracks_activity";
    public static final String TRAINING_LOG = "training_log_data";
    public static final String CATEGORY = "category";

    static final Map<String, List<String>> REQUIRED_COLUMNS = Map.of(
            ACTIVITY, List.of("id", "start_time_utc", "end_time_utc", "elapsed_time_s", "moving_time_s",
                    "distance_m", "name", "sport", "tz_name", "utc_offset_minutes", "tz_source",
                    "source_quality", "created_at_utc", "updated_at_utc"),
            ACTIVITY_SOURCE, List.of("id", "activity_id", "source", "source_activity_id", "start_time_utc",
                    "start_time_local", "elapsed_time_s", "distance_m", "sport", "payload_hash",
                    "match_confidence", "ingested_at_utc"),
            GPS_ACTIVITY, List.of("activity_id", "start_date_time", "sport_type", "distance", "moving_time_s",
                    "name", "data"),
            DESKTOP_ACTIVITY, List.of("activity_id", "start_date", "start_time", "distance_m", "duration_s",
                    "category", "notes", "name"),
            TRAINING_LOG, List.of("activity_id", "category_id", "workout_type_id", "notes", "tags",
                    "is_training", "canonical_activity_id"),
            CATEGORY, List.of("id", "parent_id", "name")
    );

    private Tables() {
    }
}
