package com.activity.resolution.core.model;

import java.util.Objects;

/**
 * Decoded form of an annotation native id such as {@code activity-2728865217}
 * or {@code st-1042}. Produced only by {@link NativeIdParser}.
 *
 * @param kind     the decoded source kind
 * @param rawId    the id inside the source system, null when the kind is unknown
 * @param nativeId the original text
 */
public record NativeIdRef(SourceKind kind, String rawId, String nativeId) {

    public NativeIdRef {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(nativeId, "nativeId is required");
    }

    public boolean isKnown() {
        return kind != SourceKind.UNKNOWN;
    }

    /**
     * Returns true if this reference names the given source row.
     */
    public boolean refersTo(SourceSystem sourceSystem, String sourceNativeId) {
        return isKnown()
                && kind.getSourceSystem() == sourceSystem
                && rawId.equals(sourceNativeId);
    }
}
