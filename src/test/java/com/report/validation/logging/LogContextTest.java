package com.report.validation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forWorkflow should set workflowId, iteration and operation in MDC")
    void forWorkflowSetsMDC() {
        try (LogContext ctx = LogContext.forWorkflow("wf-1", 2)) {
            assertEquals("wf-1", MDC.get("workflowId"));
            assertEquals("2", MDC.get("iteration"));
            assertEquals("workflow", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forNode should set node identity and operation in MDC")
    void forNodeSetsMDC() {
        try (LogContext ctx = LogContext.forNode("wf-1", "insight_0", "insight")) {
            assertEquals("wf-1", MDC.get("workflowId"));
            assertEquals("insight_0", MDC.get("nodeId"));
            assertEquals("insight", MDC.get("nodeType"));
            assertEquals("score", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forRevalidation should mark the operation")
    void forRevalidationSetsMDC() {
        try (LogContext ctx = LogContext.forRevalidation("wf-1", 3)) {
            assertEquals("revalidate", MDC.get("operation"));
            assertEquals("3", MDC.get("iteration"));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC, including keys added with with()")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forWorkflow("wf-1", 1).with("generator", "stub")) {
            assertEquals("stub", MDC.get("generator"));
        }
        assertNull(MDC.get("workflowId"));
        assertNull(MDC.get("iteration"));
        assertNull(MDC.get("generator"));
    }

    @Test
    @DisplayName("Closing a node context should leave unrelated keys of the workflow context")
    void nestedContexts() {
        try (LogContext outer = LogContext.forWorkflow("wf-1", 1)) {
            try (LogContext inner = LogContext.forNode("wf-1", "insight_0", "insight")) {
                assertEquals("insight_0", MDC.get("nodeId"));
            }
            assertNull(MDC.get("nodeId"));
            assertEquals("1", MDC.get("iteration"));
        }
        assertNull(MDC.get("iteration"));
    }
}
