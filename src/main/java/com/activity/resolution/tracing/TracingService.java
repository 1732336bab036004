package com.activity.resolution.tracing;

import java.util.Map;

/**
 * Tracing seam. {@link NoOpTracingService} is the default; {@link OpenTelemetryTracingService}
 * exports through the OpenTelemetry API.
 */
public interface TracingService {

    /**
     * Starts the span covering one batch run.
     */
    default Span startRun(String operation, String runId) {
        return startSpan("activity-resolution." + operation, Map.of("run.id", runId));
    }

    Span startSpan(String name, Map<String, String> attributes);
}
