package com.report.validation.workflow;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-side handle of a running workflow: exposes the current phase and accepts a
 * cancellation request. A scoring batch already dispatched runs to completion; the
 * workflow stops at the next phase boundary.
 */
public class WorkflowHandle {

    private final String workflowId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile WorkflowPhase phase = WorkflowPhase.PENDING;
    private volatile int iteration;

    public WorkflowHandle(String workflowId) {
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId is required");
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /**
     * Requests cancellation.
     *
     * @return true if this call requested it, false if already requested
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public WorkflowPhase getPhase() {
        return phase;
    }

    public int getIteration() {
        return iteration;
    }

    void enter(WorkflowPhase newPhase, int currentIteration) {
        this.phase = newPhase;
        this.iteration = currentIteration;
    }
}
