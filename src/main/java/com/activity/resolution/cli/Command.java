package com.activity.resolution.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * CLI commands. Commands that never write ignore {@code --dry-run}.
 */
public enum Command {
    INIT_DB("init-db", "create missing tables in the database"),
    INGEST_GPS("ingest-gps", "link unlinked GPS platform rows to canonical activities"),
    INGEST_DESKTOP("ingest-desktop", "link unlinked desktop training-log rows to canonical activities"),
    BACKFILL_TIMEZONES("backfill-timezones", "fill timezone name, offset and provenance"),
    RECOMPUTE_OFFSETS("recompute-offsets", "recompute UTC offsets from stored timezone names"),
    FIND_DUPLICATES("find-duplicates", "report overlapping training activities (--csv writes the pairs)"),
    FIND_TZ_MISMATCHES("find-tz-mismatches", "report GPS/desktop pairs offset by whole hours (--csv writes merge pairs)"),
    UNTANGLE("untangle", "keep one annotation per over-linked activity"),
    MERGE("merge", "merge keep_id,drop_id pairs from --pairs"),
    CHECK_INTEGRITY("check-integrity", "report store consistency counts");

    private final String name;
    private final String description;

    Command(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<Command> fromName(String name) {
        return Arrays.stream(values()).filter(c -> c.name.equals(name)).findFirst();
    }
}
