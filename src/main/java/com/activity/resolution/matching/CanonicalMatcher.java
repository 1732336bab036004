package com.activity.resolution.matching;

import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.core.model.MatchTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a new source row belongs to an existing canonical activity.
 *
 * <p>Tier A needs the starts within 5 minutes and distance or duration within 10%.
 * Tier B is tried only if no activity reaches Tier A, with 15 minutes and 15%.
 * Duration is compared with the activity's elapsed time. Within a tier the
 * smallest start difference wins, then the smallest id. Without a match a new
 * activity is created.
 */
public class CanonicalMatcher {
    private static final Logger log = LoggerFactory.getLogger(CanonicalMatcher.class);

    private static final Comparator<Scored> BEST_FIRST = Comparator
            .comparingLong(Scored::deltaSeconds)
            .thenComparingLong(s -> s.activity().getId());

    private final MatchingOptions options;

    public CanonicalMatcher(MatchingOptions options) {
        this.options = options;
    }

    public CanonicalMatcher() {
        this(MatchingOptions.defaults());
    }

    public MatchingOptions getOptions() {
        return options;
    }

    /**
     * Start of the interval of existing activities worth comparing.
     */
    public Instant windowStart(MatchCandidate candidate) {
        return candidate.startTimeUtc().minus(options.getSearchWindow());
    }

    /**
     * End of the interval of existing activities worth comparing.
     */
    public Instant windowEnd(MatchCandidate candidate) {
        return candidate.startTimeUtc().plus(options.getSearchWindow());
    }

    /**
     * Decides the tier for a candidate against the activities found in its window.
     *
     * @param candidate the new source row
     * @param existing  persisted activities; order does not matter
     */
    public MatchOutcome decide(MatchCandidate candidate, List<CanonicalActivity> existing) {
        List<Scored> scored = existing.stream()
                .filter(a -> a.getId() != null)
                .map(a -> new Scored(a, Math.abs(Duration.between(a.getStartTimeUtc(), candidate.startTimeUtc()).getSeconds())))
                .toList();

        Optional<Scored> tierA = best(scored, candidate, options.getTierAWindow(), options.getTierATolerance());
        if (tierA.isPresent()) {
            return outcome(MatchTier.TIER_A, tierA.get());
        }
        Optional<Scored> tierB = best(scored, candidate, options.getTierBWindow(), options.getTierBTolerance());
        if (tierB.isPresent()) {
            return outcome(MatchTier.TIER_B, tierB.get());
        }
        log.debug("match.none start={} candidates={}", candidate.startTimeUtc(), existing.size());
        return MatchOutcome.create();
    }

    private Optional<Scored> best(List<Scored> scored, MatchCandidate candidate, Duration window, double tolerance) {
        long windowSeconds = window.getSeconds();
        return scored.stream()
                .filter(s -> s.deltaSeconds() <= windowSeconds)
                .filter(s -> metricsClose(s.activity(), candidate, tolerance))
                .min(BEST_FIRST);
    }

    private boolean metricsClose(CanonicalActivity activity, MatchCandidate candidate, double tolerance) {
        return RelativeCloseness.isClose(activity.getDistanceM(), candidate.distanceM(), tolerance)
                || RelativeCloseness.isClose(activity.getElapsedTimeS(), candidate.durationS(), tolerance);
    }

    private MatchOutcome outcome(MatchTier tier, Scored scored) {
        log.debug("match.found tier={} activityId={} deltaSeconds={}",
                tier.getCode(), scored.activity().getId(), scored.deltaSeconds());
        return MatchOutcome.link(tier, scored.activity().getId(), scored.deltaSeconds());
    }

    private record Scored(CanonicalActivity activity, long deltaSeconds) {
    }
}
