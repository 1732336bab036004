package com.activity.resolution.matching;

import java.time.Duration;

/**
 * Thresholds for matching a source row against existing canonical activities.
 */
public class MatchingOptions {

    private static final Duration DEFAULT_TIER_A_WINDOW = Duration.ofMinutes(5);
    private static final Duration DEFAULT_TIER_B_WINDOW = Duration.ofMinutes(15);
    private static final double DEFAULT_TIER_A_TOLERANCE = 0.10;
    private static final double DEFAULT_TIER_B_TOLERANCE = 0.15;

    private final Duration tierAWindow;
    private final Duration tierBWindow;
    private final double tierATolerance;
    private final double tierBTolerance;

    private MatchingOptions(Builder builder) {
        this.tierAWindow = builder.tierAWindow;
        this.tierBWindow = builder.tierBWindow;
        this.tierATolerance = builder.tierATolerance;
        this.tierBTolerance = builder.tierBTolerance;
    }

    public Duration getTierAWindow() {
        return tierAWindow;
    }

    public Duration getTierBWindow() {
        return tierBWindow;
    }

    public double getTierATolerance() {
        return tierATolerance;
    }

    public double getTierBTolerance() {
        return tierBTolerance;
    }

    /**
     * Half-width of the start-time window searched for candidates.
     */
    public Duration getSearchWindow() {
        return tierBWindow;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration tierAWindow = DEFAULT_TIER_A_WINDOW;
        private Duration tierBWindow = DEFAULT_TIER_B_WINDOW;
        private double tierATolerance = DEFAULT_TIER_A_TOLERANCE;
        private double tierBTolerance = DEFAULT_TIER_B_TOLERANCE;

        public Builder tierAWindow(Duration tierAWindow) {
            validateWindow(tierAWindow, "tierAWindow");
            this.tierAWindow = tierAWindow;
            return this;
        }

        public Builder tierBWindow(Duration tierBWindow) {
            validateWindow(tierBWindow, "tierBWindow");
            this.tierBWindow = tierBWindow;
            return this;
        }

        public Builder tierATolerance(double tierATolerance) {
            validateTolerance(tierATolerance, "tierATolerance");
            this.tierATolerance = tierATolerance;
            return this;
        }

        public Builder tierBTolerance(double tierBTolerance) {
            validateTolerance(tierBTolerance, "tierBTolerance");
            this.tierBTolerance = tierBTolerance;
            return this;
        }

        public MatchingOptions build() {
            if (tierAWindow.compareTo(tierBWindow) > 0) {
                throw new IllegalArgumentException("tierAWindow must be <= tierBWindow");
            }
            if (tierATolerance > tierBTolerance) {
                throw new IllegalArgumentException("tierATolerance must be <= tierBTolerance");
            }
            return new MatchingOptions(this);
        }

        private void validateWindow(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }

        private void validateTolerance(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
