package com.report.validation.metrics;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.WorkflowStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordJudgeCall(IssueCategory category, boolean success, Duration duration) {
    }

    @Override
    public void incrementJudgeRetry(IssueCategory category) {
    }

    @Override
    public void incrementJudgeUnavailable(IssueCategory category) {
    }

    @Override
    public void recordNodeScoringDuration(NodeType type, Duration duration) {
    }

    @Override
    public void recordNodeConfidence(int confidence) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordRevalidation(int revalidatedNodes, int carriedForwardNodes) {
    }

    @Override
    public void recordWorkflowCompleted(WorkflowStatus status, int iterations) {
    }
}
