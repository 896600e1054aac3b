package com.report.validation.feedback;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Severity;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A specific, actionable remediation tied to one issue.
 *
 * @param feedbackId              stable id derived from the issue id
 * @param issueId                 the issue this item remediates
 * @param nodeId                  node the issue was found on
 * @param nodeType                type of that node
 * @param category                issue category
 * @param severity                issue severity
 * @param specificAction          what to change
 * @param implementationSteps     ordered checklist
 * @param exampleBefore           illustrative text before the fix
 * @param exampleAfter            illustrative text after the fix
 * @param estimatedConfidenceGain expected confidence points gained on the node
 * @param estimatedEffort         effort estimate
 * @param priority                derived priority, 1-10
 * @param successCriteria         how to verify the fix
 * @param nodeDependencies        ids of nodes the target node depends on, used for cross-node sequencing
 */
public record Feedback(
        String feedbackId,
        String issueId,
        String nodeId,
        NodeType nodeType,
        IssueCategory category,
        Severity severity,
        String specificAction,
        List<String> implementationSteps,
        String exampleBefore,
        String exampleAfter,
        int estimatedConfidenceGain,
        EffortLevel estimatedEffort,
        int priority,
        List<String> successCriteria,
        Set<String> nodeDependencies
) {
    public Feedback {
        Objects.requireNonNull(feedbackId, "feedbackId is required");
        Objects.requireNonNull(issueId, "issueId is required");
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(nodeType, "nodeType is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(specificAction, "specificAction is required");
        Objects.requireNonNull(estimatedEffort, "estimatedEffort is required");
        implementationSteps = implementationSteps != null ? List.copyOf(implementationSteps) : List.of();
        successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
        nodeDependencies = nodeDependencies != null ? Set.copyOf(nodeDependencies) : Set.of();
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be between 1 and 10, got " + priority);
        }
        if (estimatedConfidenceGain < 0) {
            throw new IllegalArgumentException("estimatedConfidenceGain must be >= 0");
        }
    }

    public static String idFor(String issueId) {
        return "fb:" + issueId;
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
