package com.activity.resolution.timezone;

import java.util.Locale;
import java.util.Set;

/**
 * Recognizes stationary trainer and virtual sessions.
 */
public class VirtualSessionDetector {

    private static final Set<String> VIRTUAL_TYPES = Set.of("virtualride", "virtualrun");

    private final TimezoneOptions options;

    public VirtualSessionDetector(TimezoneOptions options) {
        this.options = options;
    }

    /**
     * Returns true if the payload flags say trainer or virtual, a payload type field
     * is {@code VirtualRide} or {@code VirtualRun}, the sport names one, or a configured brand appears in the device name, external id or name.
     */
    public boolean isVirtualSession(GpsPayload payload, String sport) {
        String sportText = lower(sport);
        if (sportText.contains("virtual") || sportText.contains("trainer")) {
            return true;
        }
        if (payload == null) {
            return false;
        }
        if (payload.isTrainer() || payload.isVirtual()) {
            return true;
        }
        for (String type : payload.activityTypes()) {
            if (VIRTUAL_TYPES.contains(lower(type))) {
                return true;
            }
        }
        String device = lower(payload.deviceName());
        String externalId = lower(payload.externalId());
        String name = lower(payload.name());
        for (String brand : options.getVirtualBrands()) {
            if (device.contains(brand) || externalId.contains(brand) || name.contains(brand)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
