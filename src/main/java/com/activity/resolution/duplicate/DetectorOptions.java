package com.activity.resolution.duplicate;

import java.time.Duration;

/**
 * Options for the duplicate cluster detector.
 */
public class DetectorOptions {

    private static final Duration DEFAULT_MIN_OVERLAP = Duration.ofSeconds(60);

    private final Duration minOverlap;
    private final Duration tolerance;

    private DetectorOptions(Builder builder) {
        this.minOverlap = builder.minOverlap;
        this.tolerance = builder.tolerance;
    }

    /**
     * Shortest overlap reported as a pair.
     */
    public Duration getMinOverlap() {
        return minOverlap;
    }

    /**
     * Amount each interval is widened on both ends to catch near overlaps.
     */
    public Duration getTolerance() {
        return tolerance;
    }

    public static DetectorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration minOverlap = DEFAULT_MIN_OVERLAP;
        private Duration tolerance = Duration.ZERO;

        public Builder minOverlap(Duration minOverlap) {
            if (minOverlap == null || minOverlap.isNegative()) {
                throw new IllegalArgumentException("minOverlap must not be negative");
            }
            this.minOverlap = minOverlap;
            return this;
        }

        public Builder tolerance(Duration tolerance) {
            if (tolerance == null || tolerance.isNegative()) {
                throw new IllegalArgumentException("tolerance must not be negative");
            }
            this.tolerance = tolerance;
            return this;
        }

        public DetectorOptions build() {
            return new DetectorOptions(this);
        }
    }
}
