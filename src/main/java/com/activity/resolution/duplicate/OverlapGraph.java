package com.activity.resolution.duplicate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undirected graph of overlapping activities, for grouping pairs into clusters.
 */
class OverlapGraph {

    private final Map<Long, Set<Long>> adjacency = new LinkedHashMap<>();

    void addEdge(long a, long b) {
        adjacency.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new TreeSet<>()).add(a);
    }

    /**
     * Connected components with at least two nodes, each sorted ascending.
     * Traversal uses an explicit stack so deep chains cannot overflow.
     */
    List<List<Long>> components() {
        Set<Long> seen = new HashSet<>();
        List<List<Long>> components = new ArrayList<>();
        for (Long start : new TreeSet<>(adjacency.keySet())) {
            if (!seen.add(start)) {
                continue;
            }
            List<Long> component = new ArrayList<>();
            Deque<Long> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                Long node = stack.pop();
                component.add(node);
                for (Long next : adjacency.getOrDefault(node, Set.of())) {
                    if (seen.add(next)) {
                        stack.push(next);
                    }
                }
            }
            component.sort(null);
            components.add(component);
        }
        return components;
    }
}
