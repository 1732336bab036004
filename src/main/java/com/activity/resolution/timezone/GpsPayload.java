package com.activity.resolution.timezone;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view over the JSON payload of a GPS platform row.
 * Only the fields used for timezone resolution are exposed.
 */
public final class GpsPayload {

    private static final List<String> TYPE_FIELDS =
            List.of("type", "sport_type", "workout_type", "activity_type", "activityType");

    private final JsonNode root;

    GpsPayload(JsonNode root) {
        this.root = Objects.requireNonNull(root, "root is required");
    }

    public String timezoneLabel() {
        return text("timezone");
    }

    public boolean isTrainer() {
        return root.path("trainer").asBoolean(false);
    }

    public boolean isVirtual() {
        return root.path("virtual").asBoolean(false);
    }

    /**
     * Activity type labels the platform may carry: {@code type}, {@code sport_type},
     * {@code workout_type}, {@code activity_type} and {@code activityType}. Blank ones are left out.
     */
    public List<String> activityTypes() {
        List<String> types = new ArrayList<>();
        for (String field : TYPE_FIELDS) {
            String value = text(field);
            if (value != null && !value.isBlank()) {
                types.add(value.trim());
            }
        }
        return List.copyOf(types);
    }

    public String deviceName() {
        return text("device_name");
    }

    public String externalId() {
        return text("external_id");
    }

    public String name() {
        return text("name");
    }

    /**
     * Returns true if the payload carries any start coordinates: a map polyline,
     * a two-element {@code start_latlng} or a start latitude/longitude. An explicit
     * {@code has_latlng=false} always means no GPS.
     */
    public boolean hasGpsStart() {
        JsonNode hasLatLng = root.get("has_latlng");
        if (hasLatLng != null && hasLatLng.isBoolean() && !hasLatLng.booleanValue()) {
            return false;
        }
        JsonNode map = root.path("map");
        if (map.isObject() && (nonBlank(map.get("summary_polyline")) || nonBlank(map.get("polyline")))) {
            return true;
        }
        JsonNode startLatLng = root.get("start_latlng");
        if (startLatLng != null && startLatLng.isArray() && startLatLng.size() == 2
                && !startLatLng.get(0).isNull() && !startLatLng.get(1).isNull()) {
            return true;
        }
        return present(root.get("start_latitude")) || present(root.get("start_longitude"));
    }

    private String text(String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static boolean nonBlank(JsonNode node) {
        return node != null && !node.isNull() && !node.asText().isBlank();
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }
}
