package com.report.validation.tracing;

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
                try (Span span = noOp.startPhase("scoring", "wf-1", 1)) {
                    span.setAttribute("nodes", 6L);
                    span.addEvent("batch.done");
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return the same shared span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertSame(noOp.startSpan("op1", Map.of()), noOp.startPhase("op2", "wf-1", 1));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer mockTracer;
        private SpanBuilder mockBuilder;
        private io.opentelemetry.api.trace.Span mockOtelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            mockTracer = mock(Tracer.class);
            mockBuilder = mock(SpanBuilder.class);
            mockOtelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);
            service = new OpenTelemetryTracingService(mockTracer);
        }

        @Test
        @DisplayName("Should name phase spans and tag them with workflow and iteration")
        void startPhase() {
            Span span = service.startPhase("scoring", "wf-1", 2);

            assertNotNull(span);
            verify(mockTracer).spanBuilder("report.scoring");
            verify(mockBuilder).setAttribute("workflowId", "wf-1");
            verify(mockOtelSpan).setAttribute("iteration", 2L);
        }

        @Test
        @DisplayName("Should pass initial attributes to the span builder")
        void startSpanWithAttributes() {
            service.startSpan("report.workflow", Map.of("reportKind", "INDIVIDUAL"));

            verify(mockBuilder).setAttribute("reportKind", "INDIVIDUAL");
            verify(mockBuilder).startSpan();
        }

        @Test
        @DisplayName("Should forward attributes, events and exceptions")
        void forwardCalls() {
            Span span = service.startSpan("test-op", null);
            RuntimeException ex = new RuntimeException("test error");

            span.setAttribute("status", "APPROVED");
            span.setAttribute("count", 42L);
            span.addEvent("decided");
            span.recordException(ex);

            verify(mockOtelSpan).setAttribute("status", "APPROVED");
            verify(mockOtelSpan).setAttribute("count", 42L);
            verify(mockOtelSpan).addEvent("decided");
            verify(mockOtelSpan).recordException(ex);
        }

        @Test
        @DisplayName("Should map span status")
        void setStatus() {
            Span span = service.startSpan("test-op", Map.of());

            span.setStatus(Span.SpanStatus.OK);
            span.setStatus(Span.SpanStatus.ERROR);

            verify(mockOtelSpan).setStatus(StatusCode.OK);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("Should end span on close")
        void endSpanOnClose() {
            try (Span span = service.startSpan("test-op", Map.of())) {
                span.setAttribute("key", "value");
            }

            verify(mockOtelSpan).end();
        }
    }
}
