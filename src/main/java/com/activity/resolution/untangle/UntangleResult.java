package com.activity.resolution.untangle;

import java.util.List;

/**
 * Result of an untangle run.
 *
 * @param considered       activities referenced by more than one annotation after selection
 * @param applied          activities whose extra annotations were unlinked
 * @param unlinked         annotations unlinked, or that would be in a dry run
 * @param failed           activities whose transaction was rolled back
 * @param recommendations  one decision per considered activity
 */
public record UntangleResult(long considered, long applied, long unlinked, long failed,
                             List<UntangleRecommendation> recommendations, boolean dryRun) {

    public UntangleResult {
        recommendations = List.copyOf(recommendations);
    }

    @Override
    public String toString() {
        return "UntangleResult{considered=" + considered +
                ", applied=" + applied +
                ", unlinked=" + unlinked +
                ", failed=" + failed +
                ", dryRun=" + dryRun + '}';
    }
}
