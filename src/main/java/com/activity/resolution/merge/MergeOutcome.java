package com.activity.resolution.merge;

/**
 * What happened to one merge pair.
 *
 * @param linksMoved        source links re-pointed, or that would be in a dry run
 * @param annotationsMoved  annotations re-pointed, or that would be in a dry run
 * @param message           reason for a skip or failure, null otherwise
 */
public record MergeOutcome(MergePair pair, Status status, long linksMoved, long annotationsMoved, String message) {

    public enum Status {
        MERGED("merged"),
        PLANNED("planned"),
        SKIPPED("skipped"),
        FAILED("failed");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    static MergeOutcome merged(MergePair pair, long links, long annotations) {
        return new MergeOutcome(pair, Status.MERGED, links, annotations, null);
    }

    static MergeOutcome planned(MergePair pair, long links, long annotations) {
        return new MergeOutcome(pair, Status.PLANNED, links, annotations, null);
    }

    static MergeOutcome skipped(MergePair pair, String message) {
        return new MergeOutcome(pair, Status.SKIPPED, 0, 0, message);
    }

    static MergeOutcome failed(MergePair pair, String message) {
        return new MergeOutcome(pair, Status.FAILED, 0, 0, message);
    }
}
