package com.activity.resolution.untangle;

/**
 * Rule that selected the annotation kept on an over-linked activity.
 */
public enum UntangleReason {
    /** Exactly one annotation names a source linked to the activity. */
    SINGLE_SOURCE_MATCH("single-source-match"),
    /** Several annotations matched; exactly one of the preferred kind did. */
    PREFERRED_KIND_MATCH("preferred-kind-match"),
    /** Several annotations of the preferred kind matched; smallest id wins. */
    PREFERRED_KIND_LOWEST_ID("preferred-kind-lowest-id"),
    /** No annotation matched a linked source. */
    NO_SOURCE_MATCH("no-source-match");

    private final String code;

    UntangleReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
