package com.activity.resolution.timezone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Parses GPS platform JSON payloads. Unreadable payloads are treated as absent.
 */
public class GpsPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(GpsPayloadParser.class);

    private final ObjectMapper objectMapper;

    public GpsPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GpsPayloadParser() {
        this(new ObjectMapper());
    }

    /**
     * Parses the payload of a GPS row.
     *
     * @param nativeId the GPS row id, for diagnostics
     * @param json     the payload text, may be null
     * @return the payload, or empty if missing, not an object, or not valid JSON
     */
    public Optional<GpsPayload> parse(String nativeId, String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                log.warn("timezone.payload.unreadable nativeId={} reason=not-an-object", nativeId);
                return Optional.empty();
            }
            return Optional.of(new GpsPayload(root));
        } catch (JsonProcessingException e) {
            log.warn("timezone.payload.unreadable nativeId={} reason={}", nativeId, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
