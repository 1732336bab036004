package com.activity.resolution.duplicate;

/**
 * Two activities whose intervals overlap. {@code first} starts no later than {@code second}.
 */
public record OverlapPair(ActivityInterval first, ActivityInterval second, long overlapSeconds) {
}
