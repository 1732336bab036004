package com.activity.resolution.quality;

import com.activity.resolution.store.ActivityRepository;
import com.activity.resolution.store.ActivityRepository.SourceCoverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds pairs of activities that were kept apart only because one side was
 * stored with a wrong timezone. Report only: the pairs are candidates for the
 * merge executor.
 */
public class TimezoneMismatchFinder {
    private static final Logger log = LoggerFactory.getLogger(TimezoneMismatchFinder.class);

    static final int MAX_OFFSET_HOURS = 12;
    static final long TOLERANCE_SECONDS = Duration.ofMinutes(5).getSeconds();
    static final double MAX_DISTANCE_DELTA_M = 1000.0;

    private static final long HOUR = 3600;

    private final ActivityRepository activities;

    public TimezoneMismatchFinder(ActivityRepository activities) {
        this.activities = activities;
    }

    public List<TimezoneMismatch> find() {
        List<SourceCoverage> coverage = activities.findSourceCoverage();
        List<SourceCoverage> gpsOnly = coverage.stream().filter(SourceCoverage::isGpsOnly).toList();
        List<SourceCoverage> desktopOnly = coverage.stream()
                .filter(SourceCoverage::isDesktopOnly)
                .sorted(Comparator.comparing(SourceCoverage::startTimeUtc))
                .toList();

        List<TimezoneMismatch> mismatches = new ArrayList<>();
        for (SourceCoverage gps : gpsOnly) {
            for (SourceCoverage desktop : desktopOnly) {
                match(gps, desktop).ifPresent(mismatches::add);
            }
        }
        mismatches.sort(Comparator.comparingLong(TimezoneMismatch::residualSeconds)
                .thenComparingLong(TimezoneMismatch::gpsActivityId)
                .thenComparingLong(TimezoneMismatch::desktopActivityId));
        log.info("quality.tzMismatch.completed gpsOnly={} desktopOnly={} pairs={}",
                gpsOnly.size(), desktopOnly.size(), mismatches.size());
        return mismatches;
    }

    static Optional<TimezoneMismatch> match(SourceCoverage gps, SourceCoverage desktop) {
        if (gps.distanceM() == null || desktop.distanceM() == null) {
            return Optional.empty();
        }
        double distanceDelta = Math.abs(gps.distanceM() - desktop.distanceM());
        if (distanceDelta > MAX_DISTANCE_DELTA_M) {
            return Optional.empty();
        }
        long delta = Duration.between(gps.startTimeUtc(), desktop.startTimeUtc()).getSeconds();
        long hours = Math.round((double) delta / HOUR);
        long residual = Math.abs(delta - hours * HOUR);
        if (hours == 0 || Math.abs(hours) > MAX_OFFSET_HOURS || residual > TOLERANCE_SECONDS) {
            return Optional.empty();
        }
        return Optional.of(new TimezoneMismatch(gps.activityId(), desktop.activityId(),
                (int) hours, residual, distanceDelta));
    }
}
