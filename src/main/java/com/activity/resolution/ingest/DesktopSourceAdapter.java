package com.activity.resolution.ingest;

import com.activity.resolution.core.model.DesktopSourceRow;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.store.SourceRowRepository;
import com.activity.resolution.time.NormalizedTimestamp;
import com.activity.resolution.time.TemporalNormalizer;

import java.time.ZoneId;
import java.util.List;

/**
 * Desktop training-log rows. Date and time are separate local fields; the category
 * text serves as the sport and the name falls back to the notes, then the category.
 */
public class DesktopSourceAdapter implements SourceAdapter<DesktopSourceRow> {

    static final int SOURCE_QUALITY = 1;
    private static final String DEFAULT_NAME = "Training log activity";

    private final TemporalNormalizer normalizer;
    private final ZoneId declaredZone;

    public DesktopSourceAdapter(TemporalNormalizer normalizer, ZoneId declaredZone) {
        this.normalizer = normalizer;
        this.declaredZone = declaredZone;
    }

    @Override
    public SourceSystem source() {
        return SourceSystem.DESKTOP_LOG;
    }

    @Override
    public List<DesktopSourceRow> loadUnlinked(SourceRowRepository rows) {
        return rows.findUnlinkedDesktopRows();
    }

    @Override
    public String nativeId(DesktopSourceRow row) {
        return row.nativeId();
    }

    @Override
    public String sport(DesktopSourceRow row) {
        return row.category();
    }

    @Override
    public IngestCandidate normalize(DesktopSourceRow row) {
        NormalizedTimestamp start = normalizer.normalize(row.startDateText(), row.startTimeText(), declaredZone);
        Double distance = normalizer.parseDecimal(row.distanceText()).orElse(null);
        Long duration = normalizer.parseSeconds(row.durationText()).orElse(null);
        String sport = blankToNull(row.category());
        String name = firstNonBlank(row.name(), row.notes(), row.category(), DEFAULT_NAME);
        String hash = PayloadHasher.hash(row.nativeId(), start.localText(), start.utcText(), sport, name,
                distance, duration);
        return new IngestCandidate(source(), row.nativeId(), start, distance, duration, duration,
                sport, name, hash, SOURCE_QUALITY);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
