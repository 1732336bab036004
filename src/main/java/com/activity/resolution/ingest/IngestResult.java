package com.activity.resolution.ingest;

import com.activity.resolution.core.model.SourceSystem;

import java.util.List;

/**
 * Result of one ingest run for one source.
 *
 * @param source        the ingested source
 * @param processed     unlinked rows considered
 * @param created       new canonical activities
 * @param linkedTierA   rows linked to an existing activity at Tier A
 * @param linkedTierB   rows linked to an existing activity at Tier B
 * @param skipped       rows skipped because of an error
 * @param annotationsLinked annotations given a canonical reference
 * @param errors        one entry per skipped row
 * @param dryRun        whether nothing was written
 */
public record IngestResult(
        SourceSystem source,
        long processed,
        long created,
        long linkedTierA,
        long linkedTierB,
        long skipped,
        long annotationsLinked,
        List<IngestError> errors,
        boolean dryRun
) {
    public IngestResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long linked() {
        return linkedTierA + linkedTierB;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be ingested.
     *
     * @param nativeId the row id
     * @param rawValue the offending raw value, if known
     * @param message  what went wrong
     */
    public record IngestError(String nativeId, String rawValue, String message) {}

    @Override
    public String toString() {
        return "IngestResult{source=" + source.getCode() +
                ", processed=" + processed +
                ", created=" + created +
                ", linkedA=" + linkedTierA +
                ", linkedB=" + linkedTierB +
                ", skipped=" + skipped +
                ", annotationsLinked=" + annotationsLinked +
                ", dryRun=" + dryRun + '}';
    }
}
