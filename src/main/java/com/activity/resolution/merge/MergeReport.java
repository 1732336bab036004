package com.activity.resolution.merge;

import java.util.List;

/**
 * Per-pair outcomes of a merge run, in input order, with totals.
 */
public record MergeReport(List<MergeOutcome> outcomes, boolean dryRun) {

    public MergeReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(MergeOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public long linksMoved() {
        return outcomes.stream().mapToLong(MergeOutcome::linksMoved).sum();
    }

    public long annotationsMoved() {
        return outcomes.stream().mapToLong(MergeOutcome::annotationsMoved).sum();
    }

    @Override
    public String toString() {
        return "MergeReport{pairs=" + outcomes.size() +
                ", merged=" + count(MergeOutcome.Status.MERGED) +
                ", planned=" + count(MergeOutcome.Status.PLANNED) +
                ", skipped=" + count(MergeOutcome.Status.SKIPPED) +
                ", failed=" + count(MergeOutcome.Status.FAILED) +
                ", linksMoved=" + linksMoved() +
                ", annotationsMoved=" + annotationsMoved() +
                ", dryRun=" + dryRun + '}';
    }
}
