package com.activity.resolution.duplicate;

import java.util.List;

/**
 * Connected group of two or more mutually overlapping activities. Members are sorted by id.
 */
public record DuplicateCluster(List<ActivityInterval> members) {

    public DuplicateCluster {
        members = List.copyOf(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("A cluster has at least two members");
        }
    }

    public int size() {
        return members.size();
    }

    public long firstId() {
        return members.get(0).activityId();
    }

    public List<Long> ids() {
        return members.stream().map(ActivityInterval::activityId).toList();
    }
}
