package com.activity.resolution.timezone;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options for timezone resolution: home zone, the expected-zone allowlist and
 * the brand names that mark virtual training sessions.
 */
public class TimezoneOptions {

    public static final String DEFAULT_HOME_ZONE = "America/Chicago";
    private static final List<String> DEFAULT_VIRTUAL_BRANDS = List.of("zwift");

    private final String homeZone;
    private final Set<String> expectedZones;
    private final List<String> virtualBrands;

    private TimezoneOptions(Builder builder) {
        this.homeZone = builder.homeZone;
        this.expectedZones = builder.expectedZones;
        this.virtualBrands = builder.virtualBrands;
    }

    public String getHomeZone() {
        return homeZone;
    }

    /**
     * Zones a reported label is expected to be in. Empty means every zone is trusted.
     */
    public Set<String> getExpectedZones() {
        return expectedZones;
    }

    /**
     * Lower-case brand names searched for in device name, external id and activity name.
     */
    public List<String> getVirtualBrands() {
        return virtualBrands;
    }

    public boolean isExpected(String zoneName) {
        return expectedZones.isEmpty() || expectedZones.contains(zoneName);
    }

    public static TimezoneOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String homeZone = DEFAULT_HOME_ZONE;
        private Set<String> expectedZones = Set.of();
        private List<String> virtualBrands = DEFAULT_VIRTUAL_BRANDS;

        /**
         * Sets the home zone.
         *
         * @throws IllegalArgumentException if the zone id is not known to this JVM
         */
        public Builder homeZone(String homeZone) {
            if (homeZone == null || homeZone.isBlank()) {
                throw new IllegalArgumentException("homeZone must not be blank");
            }
            try {
                ZoneId.of(homeZone.trim());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Unknown home zone: " + homeZone, e);
            }
            this.homeZone = homeZone.trim();
            return this;
        }

        public Builder expectedZones(Set<String> expectedZones) {
            this.expectedZones = expectedZones == null ? Set.of() : expectedZones.stream()
                    .map(String::trim)
                    .filter(z -> !z.isEmpty())
                    .collect(Collectors.toUnmodifiableSet());
            return this;
        }

        public Builder virtualBrands(List<String> virtualBrands) {
            this.virtualBrands = virtualBrands == null ? List.of() : virtualBrands.stream()
                    .map(b -> b.trim().toLowerCase(Locale.ROOT))
                    .filter(b -> !b.isEmpty())
                    .toList();
            return this;
        }

        public TimezoneOptions build() {
            return new TimezoneOptions(this);
        }
    }
}
