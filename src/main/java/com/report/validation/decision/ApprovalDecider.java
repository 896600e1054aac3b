package com.report.validation.decision;

import com.report.validation.core.model.Issue;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.Severity;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.core.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the approval status of one iteration.
 *
 * <p>{@code FAILED} when any critical issue is present. {@code APPROVED} only when every
 * node meets the confidence threshold, no critical issue remains and consistency meets its
 * threshold; in strict mode high-severity issues and degraded metric scores also block.
 * Everything else is {@code REQUIRES_FURTHER_REVISION}. A node without a result is never
 * approved.</p>
 */
public class ApprovalDecider {
    private static final Logger log = LoggerFactory.getLogger(ApprovalDecider.class);

    private final int confidenceThreshold;
    private final int consistencyThreshold;
    private final boolean strictMode;

    public ApprovalDecider(int confidenceThreshold, int consistencyThreshold, boolean strictMode) {
        this.confidenceThreshold = confidenceThreshold;
        this.consistencyThreshold = consistencyThreshold;
        this.strictMode = strictMode;
    }

    public ApprovalDecision decide(List<Node> nodes, Map<String, ValidationResult> results, int consistencyScore) {
        Objects.requireNonNull(nodes, "nodes is required");
        Objects.requireNonNull(results, "results is required");

        List<BlockingReason> reasons = new ArrayList<>();
        boolean critical = false;
        for (Node node : nodes) {
            ValidationResult result = results.get(node.id());
            if (result == null) {
                reasons.add(new BlockingReason(node.id(), BlockingReason.Kind.MALFORMED_NODE,
                        "No validation result for node " + node.id(), null));
                continue;
            }
            for (Issue issue : result.issues()) {
                if (issue.isCritical()) {
                    critical = true;
                    reasons.add(BlockingReason.forIssue(BlockingReason.Kind.CRITICAL_ISSUE, issue));
                } else if (strictMode && issue.severity() == Severity.HIGH) {
                    reasons.add(BlockingReason.forIssue(BlockingReason.Kind.HIGH_SEVERITY_ISSUE, issue));
                }
            }
            if (!result.meets(confidenceThreshold)) {
                reasons.add(new BlockingReason(node.id(), BlockingReason.Kind.BELOW_THRESHOLD,
                        "Confidence " + result.confidence() + " is below threshold " + confidenceThreshold, null));
            }
            if (strictMode && result.isDegraded()) {
                reasons.add(new BlockingReason(node.id(), BlockingReason.Kind.DEGRADED_SCORE,
                        "Judge was unavailable for at least one metric", null));
            }
        }
        if (consistencyScore < consistencyThreshold) {
            reasons.add(new BlockingReason(null, BlockingReason.Kind.LOW_CONSISTENCY,
                    "Cross-node consistency " + consistencyScore + " is below threshold " + consistencyThreshold,
                    null));
        }

        ValidationStatus status;
        if (critical) {
            status = ValidationStatus.FAILED;
        } else if (!reasons.isEmpty() || nodes.isEmpty()) {
            status = ValidationStatus.REQUIRES_FURTHER_REVISION;
        } else {
            status = ValidationStatus.APPROVED;
        }
        int reportConfidence = reportConfidence(nodes, results.values());
        log.debug("Decision {}: confidence={}, consistency={}, {} blocking reason(s)",
                status, reportConfidence, consistencyScore, reasons.size());
        return new ApprovalDecision(status, reportConfidence, consistencyScore, reasons);
    }

    /**
     * Importance-weighted mean of node confidences, rounded. 0 for an empty report.
     */
    public static int reportConfidence(List<Node> nodes, Collection<ValidationResult> results) {
        Map<String, Integer> importance = new HashMap<>();
        nodes.forEach(n -> importance.put(n.id(), n.importance()));
        double weighted = 0.0;
        int totalWeight = 0;
        for (ValidationResult result : results) {
            Integer weight = importance.get(result.nodeId());
            if (weight == null) {
                continue;
            }
            weighted += (double) result.confidence() * weight;
            totalWeight += weight;
        }
        return totalWeight == 0 ? 0 : (int) Math.round(weighted / totalWeight);
    }

    public int getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getConsistencyThreshold() {
        return consistencyThreshold;
    }

    public boolean isStrictMode() {
        return strictMode;
    }
}
