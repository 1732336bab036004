package com.activity.resolution.ingest;

import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.matching.MatchCandidate;
import com.activity.resolution.time.NormalizedTimestamp;

import java.util.Objects;

/**
 * A native source row after normalization, ready for matching.
 *
 * @param source        the reporting system
 * @param nativeId      the row id inside that system
 * @param start         local and UTC start
 * @param distanceM     distance in meters, null if absent
 * @param durationS     elapsed duration in seconds, null if absent
 * @param movingTimeS   moving duration in seconds, null if absent
 * @param sport         sport label, null if absent
 * @param name          display name
 * @param payloadHash   SHA-256 hex of the normalized fields
 * @param sourceQuality fidelity rank of the reporting system
 */
public record IngestCandidate(
        SourceSystem source,
        String nativeId,
        NormalizedTimestamp start,
        Double distanceM,
        Long durationS,
        Long movingTimeS,
        String sport,
        String name,
        String payloadHash,
        int sourceQuality
) {
    public IngestCandidate {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(nativeId, "nativeId is required");
        Objects.requireNonNull(start, "start is required");
    }

    public MatchCandidate toMatchCandidate() {
        return new MatchCandidate(start.utcInstant(), distanceM, durationS, sport);
    }
}
