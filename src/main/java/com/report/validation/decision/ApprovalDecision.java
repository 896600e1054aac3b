package com.report.validation.decision;

import com.report.validation.core.model.ValidationStatus;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Per-iteration decision over a complete snapshot of node results.
 *
 * @param status            approval status
 * @param reportConfidence  importance-weighted mean of node confidences
 * @param consistencyScore  cross-node consistency score the decision used
 * @param blockingReasons   everything that prevented approval, empty when approved
 */
public record ApprovalDecision(
        ValidationStatus status,
        int reportConfidence,
        int consistencyScore,
        List<BlockingReason> blockingReasons
) {
    public ApprovalDecision {
        Objects.requireNonNull(status, "status is required");
        blockingReasons = blockingReasons != null ? List.copyOf(blockingReasons) : List.of();
    }

    public boolean isApproved() {
        return status == ValidationStatus.APPROVED;
    }

    public Set<String> blockingNodeIds() {
        return blockingReasons.stream()
                .map(BlockingReason::nodeId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
