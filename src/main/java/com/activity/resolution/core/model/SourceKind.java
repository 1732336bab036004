package com.activity.resolution.core.model;

/**
 * Kind of source record an annotation native id refers to.
 * Declaration order is the fallback preference order of the link untangler.
 */
public enum SourceKind {
    GPS(SourceSystem.GPS_PLATFORM),
    DESKTOP(SourceSystem.DESKTOP_LOG),
    UNKNOWN(null);

    private final SourceSystem sourceSystem;

    SourceKind(SourceSystem sourceSystem) {
        this.sourceSystem = sourceSystem;
    }

    /**
     * Returns the source system of this kind, or null for {@link #UNKNOWN}.
     */
    public SourceSystem getSourceSystem() {
        return sourceSystem;
    }
}
