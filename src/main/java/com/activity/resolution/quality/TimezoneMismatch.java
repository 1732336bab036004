package com.activity.resolution.quality;

/**
 * A GPS-only activity and a desktop-only activity that look like the same
 * workout recorded with a wrong zone.
 *
 * @param offsetHours     whole hours between the two starts, positive when the desktop start is later
 * @param residualSeconds distance of the start difference from {@code offsetHours}
 */
public record TimezoneMismatch(long gpsActivityId, long desktopActivityId, int offsetHours,
                               long residualSeconds, double distanceDeltaM) {
}
