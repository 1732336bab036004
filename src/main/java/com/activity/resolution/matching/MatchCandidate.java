package com.activity.resolution.matching;

import java.time.Instant;
import java.util.Objects;

/**
 * What the matcher knows about a new source row.
 */
public record MatchCandidate(Instant startTimeUtc, Double distanceM, Long durationS, String sport) {

    public MatchCandidate {
        Objects.requireNonNull(startTimeUtc, "startTimeUtc is required");
    }
}
