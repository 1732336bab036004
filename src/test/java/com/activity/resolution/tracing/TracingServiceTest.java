package com.activity.resolution.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startRun("merge", "run-1")) {
                    span.setAttribute("pairs", 3L);
                    span.setAttribute("dryRun", true);
                    span.addEvent("row.skipped");
                    span.setOutcome(Span.Outcome.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("a", Map.of()), noOp.startRun("b", "run-1"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Run spans are named by operation and carry the run id")
        void runSpan() {
            service.startRun("ingest-strava", "run-9");

            verify(tracer).spanBuilder("activity-resolution.ingest-strava");
            verify(builder).setAttribute("run.id", "run-9");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Attributes, events and exceptions are forwarded")
        void forwards() {
            Span span = service.startSpan("op", null);
            RuntimeException ex = new RuntimeException("boom");

            span.setAttribute("key", "value");
            span.setAttribute("count", 42L);
            span.addEvent("row.skipped");
            span.recordException(ex);

            verify(otelSpan).setAttribute("key", "value");
            verify(otelSpan).setAttribute("count", 42L);
            verify(otelSpan).addEvent("row.skipped");
            verify(otelSpan).recordException(ex);
        }

        @Test
        @DisplayName("Outcome maps to status and close ends the span")
        void outcomeAndClose() {
            Span span = service.startSpan("op", Map.of());

            span.setOutcome(Span.Outcome.ERROR);
            span.close();

            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).end();
        }
    }
}
