package com.activity.resolution.tracing;

import java.util.Map;

/**
 * Tracing that records nothing.
 */
public class NoOpTracingService implements TracingService {

    private static final Span SILENT = new SilentSpan();

    @Override
    public Span startSpan(String name, Map<String, String> attributes) {
        return SILENT;
    }

    private static final class SilentSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
            // nothing recorded
        }

        @Override
        public void setAttribute(String key, long value) {
            // nothing recorded
        }

        @Override
        public void setAttribute(String key, boolean value) {
            // nothing recorded
        }

        @Override
        public void addEvent(String name) {
            // nothing recorded
        }

        @Override
        public void setOutcome(Outcome outcome) {
            // nothing recorded
        }

        @Override
        public void recordException(Throwable t) {
            // nothing recorded
        }

        @Override
        public void close() {
            // nothing to end
        }
    }
}
