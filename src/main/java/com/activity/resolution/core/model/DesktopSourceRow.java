package com.activity.resolution.core.model;

/**
 * Raw row of the desktop training-log table. Date and time are separate local text fields.
 */
public record DesktopSourceRow(
        String nativeId,
        String startDateText,
        String startTimeText,
        String distanceText,
        String durationText,
        String category,
        String notes,
        String name
) {
}
