package com.activity.resolution.duplicate;

import com.activity.resolution.time.UtcTimestamps;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;

/**
 * Writes overlapping pairs as CSV, one row per pair in report order.
 *
 * <pre>
 * overlap_seconds,a_id,a_start_utc,a_end_utc,a_sport,a_distance_m,a_name,b_id,...
 * 3540,17,2024-03-10T13:00:00Z,2024-03-10T14:00:00Z,Run,10010.0,Morning run,42,...
 * </pre>
 */
public class OverlapPairCsvWriter {

    static final String HEADER = "overlap_seconds,"
            + "a_id,a_start_utc,a_end_utc,a_sport,a_distance_m,a_name,"
            + "b_id,b_start_utc,b_end_utc,b_sport,b_distance_m,b_name";

    public void write(List<OverlapPair> pairs, Writer writer) throws IOException {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        pw.println(HEADER);
        for (OverlapPair pair : pairs) {
            pw.println(pair.overlapSeconds() + "," + columns(pair.first()) + "," + columns(pair.second()));
        }
        pw.flush();
        if (pw.checkError()) {
            throw new IOException("Failed writing overlap CSV");
        }
    }

    private String columns(ActivityInterval interval) {
        return interval.activityId() + ","
                + UtcTimestamps.format(interval.start()) + ","
                + UtcTimestamps.format(interval.end()) + ","
                + csvEscape(interval.sport()) + ","
                + (interval.distanceM() == null ? "" : interval.distanceM()) + ","
                + csvEscape(interval.name());
    }

    private String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
