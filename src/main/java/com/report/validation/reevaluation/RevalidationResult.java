package com.report.validation.reevaluation;

import com.report.validation.consistency.ConsistencyDelta;
import com.report.validation.consistency.ConsistencyReport;
import com.report.validation.core.model.Issue;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.core.model.ValidationStatus;
import com.report.validation.decision.ApprovalDecision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one re-evaluation pass.
 *
 * <p>Partitions the current results into re-validated and carried-forward nodes, lists
 * issue and consistency deltas against the previous iteration, attributes regressions to
 * the feedback that caused them and carries the per-iteration decision with its blocking
 * reasons.</p>
 */
public final class RevalidationResult {

    private final String workflowId;
    private final int iteration;
    private final ValidationStatus status;
    private final List<Node> nodes;
    private final ChangeSet changes;
    private final Map<String, ValidationResult> revalidatedNodes;
    private final Map<String, ValidationResult> unchangedNodes;
    private final Map<String, String> failedNodes;
    private final List<Issue> newIssues;
    private final List<Issue> resolvedIssues;
    private final ConsistencyReport consistency;
    private final ConsistencyDelta consistencyDelta;
    private final List<RegressionIssue> regressionIssues;
    private final List<FeedbackEffectiveness> feedbackEffectiveness;
    private final List<IntegrityViolation> integrityViolations;
    private final ApprovalDecision decision;
    private final int previousReportConfidence;
    private final List<RevalidationPhase> phaseTrace;
    private final RevalidationMetrics metrics;
    private final List<String> recommendedActions;

    private RevalidationResult(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId is required");
        this.decision = Objects.requireNonNull(builder.decision, "decision is required");
        this.consistency = Objects.requireNonNull(builder.consistency, "consistency is required");
        this.changes = Objects.requireNonNull(builder.changes, "changes is required");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics is required");
        this.iteration = builder.iteration;
        this.status = builder.decision.status();
        this.nodes = builder.nodes != null ? List.copyOf(builder.nodes) : List.of();
        this.revalidatedNodes = copy(builder.revalidatedNodes);
        this.unchangedNodes = copy(builder.unchangedNodes);
        this.failedNodes = copy(builder.failedNodes);
        this.newIssues = builder.newIssues != null ? List.copyOf(builder.newIssues) : List.of();
        this.resolvedIssues = builder.resolvedIssues != null ? List.copyOf(builder.resolvedIssues) : List.of();
        this.consistencyDelta = builder.consistencyDelta;
        this.regressionIssues = builder.regressionIssues != null ? List.copyOf(builder.regressionIssues) : List.of();
        this.feedbackEffectiveness = builder.feedbackEffectiveness != null
                ? List.copyOf(builder.feedbackEffectiveness) : List.of();
        this.integrityViolations = builder.integrityViolations != null
                ? List.copyOf(builder.integrityViolations) : List.of();
        this.previousReportConfidence = builder.previousReportConfidence;
        this.phaseTrace = builder.phaseTrace != null ? List.copyOf(builder.phaseTrace) : List.of();
        this.recommendedActions = builder.recommendedActions != null
                ? List.copyOf(builder.recommendedActions) : List.of();
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public int getIteration() {
        return iteration;
    }

    public ValidationStatus getStatus() {
        return status;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public ChangeSet getChanges() {
        return changes;
    }

    public Map<String, ValidationResult> getRevalidatedNodes() {
        return revalidatedNodes;
    }

    public Map<String, ValidationResult> getUnchangedNodes() {
        return unchangedNodes;
    }

    /**
     * Current result of every scored node: re-validated results first, then carried-forward ones.
     */
    public Map<String, ValidationResult> getCurrentResults() {
        Map<String, ValidationResult> all = new LinkedHashMap<>(revalidatedNodes);
        all.putAll(unchangedNodes);
        return Collections.unmodifiableMap(all);
    }

    /**
     * Nodes whose scoring task failed, with the error description. They have no current result.
     */
    public Map<String, String> getFailedNodes() {
        return failedNodes;
    }

    public List<Issue> getNewIssues() {
        return newIssues;
    }

    public List<Issue> getResolvedIssues() {
        return resolvedIssues;
    }

    public ConsistencyReport getConsistency() {
        return consistency;
    }

    public ConsistencyDelta getConsistencyDelta() {
        return consistencyDelta;
    }

    public List<RegressionIssue> getRegressionIssues() {
        return regressionIssues;
    }

    public List<FeedbackEffectiveness> getFeedbackEffectiveness() {
        return feedbackEffectiveness;
    }

    public List<IntegrityViolation> getIntegrityViolations() {
        return integrityViolations;
    }

    public ApprovalDecision getDecision() {
        return decision;
    }

    public int getReportConfidence() {
        return decision.reportConfidence();
    }

    public int getConfidenceImprovement() {
        return decision.reportConfidence() - previousReportConfidence;
    }

    public int getCriticalIssuesRemaining() {
        return (int) getCurrentResults().values().stream()
                .flatMap(r -> r.issues().stream())
                .filter(Issue::isCritical)
                .count();
    }

    public Set<String> getBlockingNodeIds() {
        return decision.blockingNodeIds();
    }

    public boolean requiresAnotherIteration() {
        return status != ValidationStatus.APPROVED;
    }

    public List<RevalidationPhase> getPhaseTrace() {
        return phaseTrace;
    }

    public RevalidationMetrics getMetrics() {
        return metrics;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    /**
     * Baseline for the next re-evaluation pass.
     */
    public ValidationSnapshot toSnapshot() {
        return new ValidationSnapshot(iteration, nodes, getCurrentResults(), consistency);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RevalidationResult{" +
                "workflowId='" + workflowId + '\'' +
                ", iteration=" + iteration +
                ", status=" + status +
                ", revalidated=" + revalidatedNodes.size() +
                ", unchanged=" + unchangedNodes.size() +
                ", newIssues=" + newIssues.size() +
                ", resolvedIssues=" + resolvedIssues.size() +
                ", regressions=" + regressionIssues.size() +
                '}';
    }

    public static class Builder {
        private String workflowId;
        private int iteration;
        private List<Node> nodes;
        private ChangeSet changes;
        private Map<String, ValidationResult> revalidatedNodes;
        private Map<String, ValidationResult> unchangedNodes;
        private Map<String, String> failedNodes;
        private List<Issue> newIssues;
        private List<Issue> resolvedIssues;
        private ConsistencyReport consistency;
        private ConsistencyDelta consistencyDelta;
        private List<RegressionIssue> regressionIssues;
        private List<FeedbackEffectiveness> feedbackEffectiveness;
        private List<IntegrityViolation> integrityViolations;
        private ApprovalDecision decision;
        private int previousReportConfidence;
        private List<RevalidationPhase> phaseTrace;
        private RevalidationMetrics metrics;
        private List<String> recommendedActions;

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder iteration(int iteration) {
            this.iteration = iteration;
            return this;
        }

        public Builder nodes(List<Node> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder changes(ChangeSet changes) {
            this.changes = changes;
            return this;
        }

        public Builder revalidatedNodes(Map<String, ValidationResult> revalidatedNodes) {
            this.revalidatedNodes = revalidatedNodes;
            return this;
        }

        public Builder unchangedNodes(Map<String, ValidationResult> unchangedNodes) {
            this.unchangedNodes = unchangedNodes;
            return this;
        }

        public Builder failedNodes(Map<String, String> failedNodes) {
            this.failedNodes = failedNodes;
            return this;
        }

        public Builder newIssues(List<Issue> newIssues) {
            this.newIssues = newIssues;
            return this;
        }

        public Builder resolvedIssues(List<Issue> resolvedIssues) {
            this.resolvedIssues = resolvedIssues;
            return this;
        }

        public Builder consistency(ConsistencyReport consistency) {
            this.consistency = consistency;
            return this;
        }

        public Builder consistencyDelta(ConsistencyDelta consistencyDelta) {
            this.consistencyDelta = consistencyDelta;
            return this;
        }

        public Builder regressionIssues(List<RegressionIssue> regressionIssues) {
            this.regressionIssues = regressionIssues;
            return this;
        }

        public Builder feedbackEffectiveness(List<FeedbackEffectiveness> feedbackEffectiveness) {
            this.feedbackEffectiveness = feedbackEffectiveness;
            return this;
        }

        public Builder integrityViolations(List<IntegrityViolation> integrityViolations) {
            this.integrityViolations = integrityViolations;
            return this;
        }

        public Builder decision(ApprovalDecision decision) {
            this.decision = decision;
            return this;
        }

        public Builder previousReportConfidence(int previousReportConfidence) {
            this.previousReportConfidence = previousReportConfidence;
            return this;
        }

        public Builder phaseTrace(List<RevalidationPhase> phaseTrace) {
            this.phaseTrace = phaseTrace;
            return this;
        }

        public Builder metrics(RevalidationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder recommendedActions(List<String> recommendedActions) {
            this.recommendedActions = recommendedActions;
            return this;
        }

        public RevalidationResult build() {
            return new RevalidationResult(this);
        }
    }
}
