package com.activity.resolution.core.model;

/**
 * Raw row of the GPS platform table. Numeric fields stay text until normalized.
 */
public record GpsSourceRow(
        String nativeId,
        String startLocalText,
        String sport,
        String distanceText,
        String movingTimeText,
        String name,
        String payloadJson
) {
}
