package com.activity.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Association of one native source row with a canonical activity.
 * Carries the fields captured at ingestion so later runs need not re-read the source.
 *
 * @param id                  store-assigned id, null before insert
 * @param canonicalActivityId the owning canonical activity
 * @param sourceSystem        which system reported the row
 * @param sourceNativeId      the row id inside that system
 * @param startTimeUtc        normalized start instant
 * @param startTimeLocal      local wall clock text, {@code yyyy-MM-dd'T'HH:mm:ss}
 * @param distanceM           distance in meters, may be null
 * @param durationS           duration in seconds, may be null
 * @param sport               sport label, may be null
 * @param payloadHash         SHA-256 hex of the normalized fields
 * @param matchTier           how the row was attached
 * @param ingestedAt          when the link was written
 */
public record SourceLink(
        Long id,
        long canonicalActivityId,
        SourceSystem sourceSystem,
        String sourceNativeId,
        Instant startTimeUtc,
        String startTimeLocal,
        Double distanceM,
        Long durationS,
        String sport,
        String payloadHash,
        MatchTier matchTier,
        Instant ingestedAt
) {
    public SourceLink {
        Objects.requireNonNull(sourceSystem, "sourceSystem is required");
        Objects.requireNonNull(sourceNativeId, "sourceNativeId is required");
        Objects.requireNonNull(matchTier, "matchTier is required");
    }

    /**
     * Native id normalized for comparison with annotation references.
     */
    public String normalizedNativeId() {
        return NativeIdParser.normalizeSourceId(sourceSystem, sourceNativeId);
    }
}
