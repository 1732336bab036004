package com.activity.resolution.duplicate;

import com.activity.resolution.core.model.CanonicalActivity;
import com.activity.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Finds canonical activities whose time intervals overlap and groups them into
 * clusters of probable duplicates. Report only; nothing is merged.
 *
 * <p>Intervals are swept in start order. The active set is ordered by end so
 * members that can no longer overlap are evicted from its head; the current
 * interval is compared against what remains.
 */
public class DuplicateClusterDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateClusterDetector.class);

    private static final Comparator<ActivityInterval> START_ORDER = Comparator
            .comparing(ActivityInterval::start)
            .thenComparingLong(ActivityInterval::activityId);
    private static final Comparator<ActivityInterval> END_ORDER = Comparator
            .comparing(ActivityInterval::end)
            .thenComparingLong(ActivityInterval::activityId);
    private static final Comparator<OverlapPair> REPORT_ORDER = Comparator
            .comparingLong(OverlapPair::overlapSeconds).reversed()
            .thenComparing(p -> p.first().start())
            .thenComparing(p -> p.second().start())
            .thenComparingLong(p -> p.first().activityId())
            .thenComparingLong(p -> p.second().activityId());
    private static final Comparator<DuplicateCluster> CLUSTER_ORDER = Comparator
            .comparingInt(DuplicateCluster::size).reversed()
            .thenComparingLong(DuplicateCluster::firstId);

    private final DetectorOptions options;
    private final MetricsService metrics;

    public DuplicateClusterDetector(DetectorOptions options, MetricsService metrics) {
        this.options = options;
        this.metrics = metrics;
    }

    public DuplicateReport detect(List<CanonicalActivity> activities) {
        List<ActivityInterval> intervals = new ArrayList<>();
        List<Long> excluded = new ArrayList<>();
        for (CanonicalActivity activity : activities) {
            Optional<Instant> end = activity.effectiveEnd();
            if (end.isEmpty()) {
                log.warn("duplicate.interval.excluded activityId={} start={} end={} elapsedS={}",
                        activity.getId(), activity.getStartTimeUtc(), activity.getEndTimeUtc(),
                        activity.getElapsedTimeS());
                excluded.add(activity.getId());
                continue;
            }
            intervals.add(ActivityInterval.of(activity, end.get()));
        }

        List<OverlapPair> pairs = findPairs(intervals);
        pairs.sort(REPORT_ORDER);

        OverlapGraph graph = new OverlapGraph();
        pairs.forEach(p -> graph.addEdge(p.first().activityId(), p.second().activityId()));
        Map<Long, ActivityInterval> byId = new HashMap<>();
        intervals.forEach(i -> byId.put(i.activityId(), i));

        List<DuplicateCluster> clusters = new ArrayList<>();
        for (List<Long> component : graph.components()) {
            DuplicateCluster cluster = new DuplicateCluster(component.stream().map(byId::get).toList());
            clusters.add(cluster);
            metrics.recordClusterSize(cluster.size());
        }
        clusters.sort(CLUSTER_ORDER);

        log.info("duplicate.detected examined={} excluded={} pairs={} clusters={} minOverlapS={} toleranceS={}",
                intervals.size(), excluded.size(), pairs.size(), clusters.size(),
                options.getMinOverlap().getSeconds(), options.getTolerance().getSeconds());
        return new DuplicateReport(intervals.size(), excluded, pairs, clusters);
    }

    List<OverlapPair> findPairs(List<ActivityInterval> intervals) {
        Duration tolerance = options.getTolerance();
        long minOverlap = options.getMinOverlap().getSeconds();

        List<ActivityInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(START_ORDER);

        PriorityQueue<ActivityInterval> active = new PriorityQueue<>(END_ORDER);
        List<OverlapPair> pairs = new ArrayList<>();
        for (ActivityInterval current : sorted) {
            Instant horizon = current.start().minus(tolerance);
            while (!active.isEmpty() && active.peek().end().plus(tolerance).isBefore(horizon)) {
                active.poll();
            }
            for (ActivityInterval previous : active) {
                long overlap = overlapSeconds(previous, current, tolerance);
                if (overlap >= minOverlap) {
                    pairs.add(new OverlapPair(previous, current, overlap));
                }
            }
            active.add(current);
        }
        return pairs;
    }

    private static long overlapSeconds(ActivityInterval a, ActivityInterval b, Duration tolerance) {
        Instant latestStart = max(a.start(), b.start()).minus(tolerance);
        Instant earliestEnd = min(a.end(), b.end()).plus(tolerance);
        return Duration.between(latestStart, earliestEnd).getSeconds();
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
