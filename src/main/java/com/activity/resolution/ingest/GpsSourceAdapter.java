package com.activity.resolution.ingest;

import com.activity.resolution.core.model.GpsSourceRow;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.store.SourceRowRepository;
import com.activity.resolution.time.NormalizedTimestamp;
import com.activity.resolution.time.TemporalNormalizer;

import java.time.ZoneId;
import java.util.List;

/**
 * GPS platform rows. The start text is local time in the declared zone; moving
 * time is the only duration reported and stands in for elapsed time.
 */
public class GpsSourceAdapter implements SourceAdapter<GpsSourceRow> {

    static final int SOURCE_QUALITY = 2;

    private final TemporalNormalizer normalizer;
    private final ZoneId declaredZone;

    public GpsSourceAdapter(TemporalNormalizer normalizer, ZoneId declaredZone) {
        this.normalizer = normalizer;
        this.declaredZone = declaredZone;
    }

    @Override
    public SourceSystem source() {
        return SourceSystem.GPS_PLATFORM;
    }

    @Override
    public List<GpsSourceRow> loadUnlinked(SourceRowRepository rows) {
        return rows.findUnlinkedGpsRows();
    }

    @Override
    public String nativeId(GpsSourceRow row) {
        return row.nativeId();
    }

    @Override
    public String sport(GpsSourceRow row) {
        return row.sport();
    }

    @Override
    public IngestCandidate normalize(GpsSourceRow row) {
        NormalizedTimestamp start = normalizer.normalize(row.startLocalText(), declaredZone);
        Double distance = normalizer.parseDecimal(row.distanceText()).orElse(null);
        Long movingTime = normalizer.parseSeconds(row.movingTimeText()).orElse(null);
        String sport = blankToNull(row.sport());
        String name = blankToNull(row.name()) != null ? row.name().trim() : "GPS activity " + row.nativeId();
        String hash = PayloadHasher.hash(row.nativeId(), start.localText(), start.utcText(), sport, name,
                distance, movingTime);
        return new IngestCandidate(source(), row.nativeId(), start, distance, movingTime, movingTime,
                sport, name, hash, SOURCE_QUALITY);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
