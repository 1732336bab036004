package com.activity.resolution.matching;

/**
 * Relative comparison of two metric values.
 */
public final class RelativeCloseness {

    private RelativeCloseness() {
    }

    /**
     * Returns true if {@code |a - b| / max(a, b) <= tolerance}. Absent or zero values never match.
     */
    public static boolean isClose(Number a, Number b, double tolerance) {
        if (a == null || b == null) {
            return false;
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        if (x == 0.0 || y == 0.0) {
            return false;
        }
        return Math.abs(x - y) / Math.max(x, y) <= tolerance;
    }
}
