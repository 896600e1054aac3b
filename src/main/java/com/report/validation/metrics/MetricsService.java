package com.report.validation.metrics;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.WorkflowStatus;

import java.time.Duration;

/**
 * Interface for recording validation pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline works without
 * a metrics backend.
 */
public interface MetricsService {

    void recordJudgeCall(IssueCategory category, boolean success, Duration duration);

    void incrementJudgeRetry(IssueCategory category);

    void incrementJudgeUnavailable(IssueCategory category);

    void recordNodeScoringDuration(NodeType type, Duration duration);

    void recordNodeConfidence(int confidence);

    void recordCacheHit();

    void recordCacheMiss();

    void recordRevalidation(int revalidatedNodes, int carriedForwardNodes);

    void recordWorkflowCompleted(WorkflowStatus status, int iterations);
}
