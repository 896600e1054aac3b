package com.report.validation.tracing;

import java.util.Map;

/**
 * Tracing integration point. The default {@link NoOpTracingService} does nothing.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts a span for one workflow phase, named {@code report.<phase>}.
     */
    default Span startPhase(String phase, String workflowId, int iteration) {
        Span span = startSpan("report." + phase, Map.of("workflowId", workflowId));
        span.setAttribute("iteration", iteration);
        return span;
    }
}
