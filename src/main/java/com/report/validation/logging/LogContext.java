package com.report.validation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured logging.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forWorkflow(workflowId, iteration)) {
 *     log.info("workflow.iteration status={} confidence={}", status, confidence);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forWorkflow(String workflowId, int iteration) {
        LogContext ctx = new LogContext();
        ctx.put("workflowId", workflowId);
        ctx.put("iteration", Integer.toString(iteration));
        ctx.put("operation", "workflow");
        return ctx;
    }

    public static LogContext forNode(String workflowId, String nodeId, String nodeType) {
        LogContext ctx = new LogContext();
        ctx.put("workflowId", workflowId);
        ctx.put("nodeId", nodeId);
        ctx.put("nodeType", nodeType);
        ctx.put("operation", "score");
        return ctx;
    }

    public static LogContext forRevalidation(String workflowId, int iteration) {
        LogContext ctx = new LogContext();
        ctx.put("workflowId", workflowId);
        ctx.put("iteration", Integer.toString(iteration));
        ctx.put("operation", "revalidate");
        return ctx;
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
