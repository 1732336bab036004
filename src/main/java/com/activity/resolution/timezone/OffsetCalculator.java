package com.activity.resolution.timezone;

import com.activity.resolution.core.exception.LookupException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Computes DST-aware UTC offsets from the JVM's zone rules.
 */
public class OffsetCalculator {

    /**
     * Returns the offset of the zone at the instant, in minutes east of UTC.
     *
     * @throws LookupException if the zone id cannot be resolved
     */
    public int offsetMinutes(Instant instant, String zoneName) {
        ZoneId zone = resolveZone(zoneName);
        return zone.getRules().getOffset(instant).getTotalSeconds() / 60;
    }

    /**
     * @throws LookupException if the zone id cannot be resolved
     */
    public ZoneId resolveZone(String zoneName) {
        if (zoneName == null || zoneName.isBlank()) {
            throw new LookupException("Blank timezone name");
        }
        try {
            return ZoneId.of(zoneName.trim());
        } catch (DateTimeException e) {
            throw new LookupException("Unknown timezone '" + zoneName + "'", e);
        }
    }
}
