package com.activity.resolution.merge;

/**
 * Operator-confirmed instruction to fold {@code dropId} into {@code keepId}.
 */
public record MergePair(long keepId, long dropId) {

    public MergePair {
        if (keepId == dropId) {
            throw new IllegalArgumentException("keep_id and drop_id must differ: " + keepId);
        }
    }

    @Override
    public String toString() {
        return keepId + "<-" + dropId;
    }
}
