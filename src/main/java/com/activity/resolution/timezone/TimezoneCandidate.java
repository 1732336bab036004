package com.activity.resolution.timezone;

import com.activity.resolution.core.model.TimezoneProvenance;

import java.time.Instant;

/**
 * A canonical activity as seen by the timezone backfill: its start, sport, current
 * timezone fields, and the payload of its GPS source row if it has one.
 */
public record TimezoneCandidate(
        long activityId,
        Instant startTimeUtc,
        String sport,
        String currentTimezoneName,
        Integer currentOffsetMinutes,
        TimezoneProvenance currentProvenance,
        String gpsNativeId,
        String gpsPayloadJson
) {
    public boolean hasTimezone() {
        return currentTimezoneName != null && !currentTimezoneName.isBlank();
    }
}
