package com.activity.resolution.timezone;

import com.activity.resolution.core.exception.LookupException;
import com.activity.resolution.core.model.TimezoneProvenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides the timezone of a canonical activity.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>an explicit label in the GPS payload: {@code source-reported}, or
 *       {@code source-suspect} when outside the expected zones;</li>
 *   <li>a trainer or virtual session without GPS start coordinates: the home zone,
 *       {@code manual-home-no-gps};</li>
 *   <li>otherwise the home zone, {@code assumed-home}.</li>
 * </ol>
 * The offset is computed at the activity start. A zone id the JVM does not know
 * keeps its name, gets no offset and is tagged {@code bad-timezone-name}.
 *
 * <p>Pure computation with no store access; safe to call from worker threads.
 */
public class TimezoneResolver {

    private static final Logger log = LoggerFactory.getLogger(TimezoneResolver.class);

    private final TimezoneOptions options;
    private final GpsPayloadParser payloadParser;
    private final VirtualSessionDetector virtualSessionDetector;
    private final OffsetCalculator offsetCalculator;

    public TimezoneResolver(TimezoneOptions options, GpsPayloadParser payloadParser,
                            OffsetCalculator offsetCalculator) {
        this.options = options;
        this.payloadParser = payloadParser;
        this.virtualSessionDetector = new VirtualSessionDetector(options);
        this.offsetCalculator = offsetCalculator;
    }

    public TimezoneResolver(TimezoneOptions options) {
        this(options, new GpsPayloadParser(), new OffsetCalculator());
    }

    public TimezoneAssignment resolve(TimezoneCandidate candidate) {
        Optional<GpsPayload> payload = payloadParser.parse(candidate.gpsNativeId(), candidate.gpsPayloadJson());

        String zoneName;
        TimezoneProvenance provenance;
        Optional<String> labelled = payload.flatMap(p -> TimezoneLabelParser.extractZoneId(p.timezoneLabel()));
        if (labelled.isPresent()) {
            zoneName = labelled.get();
            provenance = options.isExpected(zoneName)
                    ? TimezoneProvenance.SOURCE_REPORTED
                    : TimezoneProvenance.SOURCE_SUSPECT;
        } else if (isStationaryWithoutGps(payload.orElse(null), candidate.sport())) {
            zoneName = options.getHomeZone();
            provenance = TimezoneProvenance.MANUAL_HOME_NO_GPS;
        } else {
            zoneName = options.getHomeZone();
            provenance = TimezoneProvenance.ASSUMED_HOME;
        }

        return withOffset(candidate, zoneName, provenance);
    }

    /**
     * Recomputes only the offset for the activity's current zone, keeping its provenance.
     */
    public TimezoneAssignment recomputeOffset(TimezoneCandidate candidate) {
        TimezoneProvenance current = candidate.currentProvenance() != null
                ? candidate.currentProvenance()
                : TimezoneProvenance.OPERATOR;
        return withOffset(candidate, candidate.currentTimezoneName().trim(), current);
    }

    private TimezoneAssignment withOffset(TimezoneCandidate candidate, String zoneName,
                                          TimezoneProvenance provenance) {
        long activityId = candidate.activityId();
        try {
            int offset = offsetCalculator.offsetMinutes(candidate.startTimeUtc(), zoneName);
            return new TimezoneAssignment(activityId, zoneName, offset, provenance);
        } catch (LookupException e) {
            log.warn("timezone.zone.unknown activityId={} tzName={} reason={}",
                    activityId, zoneName, e.getMessage());
            return new TimezoneAssignment(activityId, zoneName, null, TimezoneProvenance.BAD_TIMEZONE_NAME);
        }
    }

    private boolean isStationaryWithoutGps(GpsPayload payload, String sport) {
        boolean noGps = payload == null || !payload.hasGpsStart();
        return noGps && virtualSessionDetector.isVirtualSession(payload, sport);
    }
}
