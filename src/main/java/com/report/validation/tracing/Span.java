package com.report.validation.tracing;

/**
 * A traced unit of pipeline work, closed with try-with-resources.
 *
 * <pre>
 * try (Span span = tracingService.startPhase("scoring", workflowId, iteration)) {
 *     span.setAttribute("nodes", nodes.size());
 *     span.setStatus(Span.SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
