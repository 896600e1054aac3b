package com.report.validation.workflow;

import com.report.validation.core.model.ValidationResult;
import com.report.validation.core.model.WorkflowStatus;
import com.report.validation.decision.BlockingReason;
import com.report.validation.feedback.FeedbackPlan;
import com.report.validation.reevaluation.RevalidationResult;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Final outcome of a validation workflow.
 *
 * <p>Always carries enough detail to explain the outcome: per-node results of the last
 * iteration, the blocking reasons and the iteration they were found in, every feedback
 * plan and re-evaluation, and the quality warnings collected along the way.</p>
 */
public final class WorkflowResult {

    private final String workflowId;
    private final WorkflowStatus status;
    private final TerminationReason terminationReason;
    private final int iterations;
    private final int reportConfidence;
    private final int consistencyScore;
    private final Map<String, ValidationResult> nodeResults;
    private final List<BlockingReason> blockingReasons;
    private final List<FeedbackPlan> feedbackPlans;
    private final List<RevalidationResult> revalidationHistory;
    private final List<IterationRecord> iterationHistory;
    private final List<QualityWarning> qualityWarnings;
    private final Map<String, NodeTrend> nodeTrends;
    private final String reviewItemId;
    private final Duration duration;

    private WorkflowResult(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.terminationReason = Objects.requireNonNull(builder.terminationReason, "terminationReason is required");
        this.iterations = builder.iterations;
        this.reportConfidence = builder.reportConfidence;
        this.consistencyScore = builder.consistencyScore;
        this.nodeResults = builder.nodeResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodeResults)) : Map.of();
        this.blockingReasons = builder.blockingReasons != null ? List.copyOf(builder.blockingReasons) : List.of();
        this.feedbackPlans = builder.feedbackPlans != null ? List.copyOf(builder.feedbackPlans) : List.of();
        this.revalidationHistory = builder.revalidationHistory != null
                ? List.copyOf(builder.revalidationHistory) : List.of();
        this.iterationHistory = builder.iterationHistory != null ? List.copyOf(builder.iterationHistory) : List.of();
        this.qualityWarnings = builder.qualityWarnings != null ? List.copyOf(builder.qualityWarnings) : List.of();
        this.nodeTrends = builder.nodeTrends != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodeTrends)) : Map.of();
        this.reviewItemId = builder.reviewItemId;
        this.duration = builder.duration != null ? builder.duration : Duration.ZERO;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public boolean isApproved() {
        return status == WorkflowStatus.APPROVED;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    public int getIterations() {
        return iterations;
    }

    public int getReportConfidence() {
        return reportConfidence;
    }

    public int getConsistencyScore() {
        return consistencyScore;
    }

    public Map<String, ValidationResult> getNodeResults() {
        return nodeResults;
    }

    /**
     * What blocked approval in the last completed iteration; empty when approved.
     */
    public List<BlockingReason> getBlockingReasons() {
        return blockingReasons;
    }

    public List<FeedbackPlan> getFeedbackPlans() {
        return feedbackPlans;
    }

    /**
     * The most recent feedback plan, if any iteration required one.
     */
    public Optional<FeedbackPlan> getLatestFeedbackPlan() {
        return feedbackPlans.isEmpty() ? Optional.empty() : Optional.of(feedbackPlans.get(feedbackPlans.size() - 1));
    }

    public List<RevalidationResult> getRevalidationHistory() {
        return revalidationHistory;
    }

    public List<IterationRecord> getIterationHistory() {
        return iterationHistory;
    }

    public List<QualityWarning> getQualityWarnings() {
        return qualityWarnings;
    }

    /**
     * True when coverage or reliability was reduced by extraction warnings, degraded
     * judge scores, scoring failures or integrity violations.
     */
    public boolean isDegraded() {
        return !qualityWarnings.isEmpty();
    }

    public Map<String, NodeTrend> getNodeTrends() {
        return nodeTrends;
    }

    /**
     * Id of the manual review item the report was routed to, if any.
     */
    public Optional<String> getReviewItemId() {
        return Optional.ofNullable(reviewItemId);
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * One-paragraph explanation of the outcome.
     */
    public String explain() {
        StringBuilder sb = new StringBuilder();
        sb.append("Workflow ").append(workflowId).append(' ').append(status)
                .append(" after ").append(iterations).append(" iteration(s) (")
                .append(terminationReason).append("), confidence ").append(reportConfidence)
                .append(", consistency ").append(consistencyScore).append('.');
        if (!blockingReasons.isEmpty()) {
            sb.append(" Blocked at iteration ").append(iterations).append(" by: ")
                    .append(blockingReasons.stream()
                            .map(r -> (r.nodeId() != null ? r.nodeId() + ": " : "") + r.description())
                            .collect(Collectors.joining("; ")))
                    .append('.');
        }
        if (reviewItemId != null) {
            sb.append(" Routed to manual review as ").append(reviewItemId).append('.');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "WorkflowResult{" +
                "workflowId='" + workflowId + '\'' +
                ", status=" + status +
                ", reason=" + terminationReason +
                ", iterations=" + iterations +
                ", confidence=" + reportConfidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String workflowId;
        private WorkflowStatus status;
        private TerminationReason terminationReason;
        private int iterations;
        private int reportConfidence;
        private int consistencyScore;
        private Map<String, ValidationResult> nodeResults;
        private List<BlockingReason> blockingReasons;
        private List<FeedbackPlan> feedbackPlans;
        private List<RevalidationResult> revalidationHistory;
        private List<IterationRecord> iterationHistory;
        private List<QualityWarning> qualityWarnings;
        private Map<String, NodeTrend> nodeTrends;
        private String reviewItemId;
        private Duration duration;

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder terminationReason(TerminationReason terminationReason) {
            this.terminationReason = terminationReason;
            return this;
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder reportConfidence(int reportConfidence) {
            this.reportConfidence = reportConfidence;
            return this;
        }

        public Builder consistencyScore(int consistencyScore) {
            this.consistencyScore = consistencyScore;
            return this;
        }

        public Builder nodeResults(Map<String, ValidationResult> nodeResults) {
            this.nodeResults = nodeResults;
            return this;
        }

        public Builder blockingReasons(List<BlockingReason> blockingReasons) {
            this.blockingReasons = blockingReasons;
            return this;
        }

        public Builder feedbackPlans(List<FeedbackPlan> feedbackPlans) {
            this.feedbackPlans = feedbackPlans;
            return this;
        }

        public Builder revalidationHistory(List<RevalidationResult> revalidationHistory) {
            this.revalidationHistory = revalidationHistory;
            return this;
        }

        public Builder iterationHistory(List<IterationRecord> iterationHistory) {
            this.iterationHistory = iterationHistory;
            return this;
        }

        public Builder qualityWarnings(List<QualityWarning> qualityWarnings) {
            this.qualityWarnings = qualityWarnings;
            return this;
        }

        public Builder nodeTrends(Map<String, NodeTrend> nodeTrends) {
            this.nodeTrends = nodeTrends;
            return this;
        }

        public Builder reviewItemId(String reviewItemId) {
            this.reviewItemId = reviewItemId;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public WorkflowResult build() {
            return new WorkflowResult(this);
        }
    }
}
