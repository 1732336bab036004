package com.activity.resolution.config;

import com.activity.resolution.duplicate.DetectorOptions;
import com.activity.resolution.matching.MatchingOptions;
import com.activity.resolution.timezone.TimezoneOptions;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Engine settings read from MicroProfile Config under the {@code activity-resolution.} prefix.
 *
 * <pre>
 * activity-resolution.db.path=/data/training.db
 * activity-resolution.timezone.home-zone=America/Chicago
 * activity-resolution.timezone.expected-zones=America/Chicago,America/Denver
 * activity-resolution.matching.tier-a-window-minutes=5
 * activity-resolution.duplicates.min-overlap-seconds=60
 * activity-resolution.workers=1
 * </pre>
 */
public class EngineConfig {

    public static final String PREFIX = "activity-resolution.";

    static final String DB_PATH = PREFIX + "db.path";
    static final String HOME_ZONE = PREFIX + "timezone.home-zone";
    static final String EXPECTED_ZONES = PREFIX + "timezone.expected-zones";
    static final String VIRTUAL_BRANDS = PREFIX + "timezone.virtual-brands";
    static final String TIER_A_WINDOW = PREFIX + "matching.tier-a-window-minutes";
    static final String TIER_B_WINDOW = PREFIX + "matching.tier-b-window-minutes";
    static final String TIER_A_TOLERANCE = PREFIX + "matching.tier-a-tolerance";
    static final String TIER_B_TOLERANCE = PREFIX + "matching.tier-b-tolerance";
    static final String MIN_OVERLAP = PREFIX + "duplicates.min-overlap-seconds";
    static final String OVERLAP_TOLERANCE = PREFIX + "duplicates.tolerance-seconds";
    static final String WORKERS = PREFIX + "workers";
    static final String CATEGORY_CACHE_SIZE = PREFIX + "category-cache.max-size";

    private final Optional<String> databasePath;
    private final TimezoneOptions timezoneOptions;
    private final MatchingOptions matchingOptions;
    private final DetectorOptions detectorOptions;
    private final int workers;
    private final long categoryCacheSize;

    private EngineConfig(Config config) {
        this.databasePath = config.getOptionalValue(DB_PATH, String.class).filter(s -> !s.isBlank());

        TimezoneOptions.Builder tz = TimezoneOptions.builder();
        config.getOptionalValue(HOME_ZONE, String.class).ifPresent(tz::homeZone);
        config.getOptionalValues(EXPECTED_ZONES, String.class)
                .ifPresent(zones -> tz.expectedZones(new LinkedHashSet<>(zones)));
        config.getOptionalValues(VIRTUAL_BRANDS, String.class).ifPresent(tz::virtualBrands);
        this.timezoneOptions = tz.build();

        MatchingOptions.Builder matching = MatchingOptions.builder();
        config.getOptionalValue(TIER_A_WINDOW, Long.class).ifPresent(m -> matching.tierAWindow(Duration.ofMinutes(m)));
        config.getOptionalValue(TIER_B_WINDOW, Long.class).ifPresent(m -> matching.tierBWindow(Duration.ofMinutes(m)));
        config.getOptionalValue(TIER_A_TOLERANCE, Double.class).ifPresent(matching::tierATolerance);
        config.getOptionalValue(TIER_B_TOLERANCE, Double.class).ifPresent(matching::tierBTolerance);
        this.matchingOptions = matching.build();

        DetectorOptions.Builder detector = DetectorOptions.builder();
        config.getOptionalValue(MIN_OVERLAP, Long.class).ifPresent(s -> detector.minOverlap(Duration.ofSeconds(s)));
        config.getOptionalValue(OVERLAP_TOLERANCE, Long.class).ifPresent(s -> detector.tolerance(Duration.ofSeconds(s)));
        this.detectorOptions = detector.build();

        this.workers = config.getOptionalValue(WORKERS, Integer.class).orElse(1);
        if (workers < 1) {
            throw new IllegalArgumentException(WORKERS + " must be >= 1");
        }
        this.categoryCacheSize = config.getOptionalValue(CATEGORY_CACHE_SIZE, Long.class).orElse(1_000L);
    }

    /**
     * Reads the settings from the default MicroProfile Config of the current class loader.
     */
    public static EngineConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static EngineConfig from(Config config) {
        return new EngineConfig(config);
    }

    public Optional<String> getDatabasePath() {
        return databasePath;
    }

    public TimezoneOptions getTimezoneOptions() {
        return timezoneOptions;
    }

    /**
     * Same timezone settings with a different home zone.
     */
    public TimezoneOptions timezoneOptionsWithHome(String homeZone) {
        return TimezoneOptions.builder()
                .homeZone(homeZone)
                .expectedZones(timezoneOptions.getExpectedZones())
                .virtualBrands(List.copyOf(timezoneOptions.getVirtualBrands()))
                .build();
    }

    public MatchingOptions getMatchingOptions() {
        return matchingOptions;
    }

    public DetectorOptions getDetectorOptions() {
        return detectorOptions;
    }

    public int getWorkers() {
        return workers;
    }

    public long getCategoryCacheSize() {
        return categoryCacheSize;
    }
}
