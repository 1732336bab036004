package com.activity.resolution.duplicate;

import java.util.List;

/**
 * Output of one detector run.
 *
 * @param examined  activities with a usable interval
 * @param excluded  ids of activities left out for lack of a positive interval
 * @param pairs     overlapping pairs, largest overlap first
 * @param clusters  clusters of size two or more, largest first
 */
public record DuplicateReport(int examined, List<Long> excluded, List<OverlapPair> pairs,
                              List<DuplicateCluster> clusters) {

    public DuplicateReport {
        excluded = List.copyOf(excluded);
        pairs = List.copyOf(pairs);
        clusters = List.copyOf(clusters);
    }
}
