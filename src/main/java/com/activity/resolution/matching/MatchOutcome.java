package com.activity.resolution.matching;

import com.activity.resolution.core.model.MatchTier;

import java.util.Objects;

/**
 * Matcher decision: the tier and, for a link, the chosen activity and start difference.
 */
public record MatchOutcome(MatchTier tier, Long activityId, Long startDeltaSeconds) {

    public MatchOutcome {
        Objects.requireNonNull(tier, "tier is required");
        if (tier.isLink() && activityId == null) {
            throw new IllegalArgumentException("A link outcome needs an activity id");
        }
    }

    public static MatchOutcome create() {
        return new MatchOutcome(MatchTier.NEW, null, null);
    }

    public static MatchOutcome link(MatchTier tier, long activityId, long startDeltaSeconds) {
        return new MatchOutcome(tier, activityId, startDeltaSeconds);
    }

    public boolean isLink() {
        return tier.isLink();
    }
}
