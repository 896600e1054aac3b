package com.report.validation.reevaluation;

import com.report.validation.consistency.ConsistencyReport;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Nodes, current results and consistency of one completed iteration.
 * The baseline the next re-evaluation diffs against.
 */
public record ValidationSnapshot(
        int iteration,
        List<Node> nodes,
        Map<String, ValidationResult> results,
        ConsistencyReport consistency
) {
    public ValidationSnapshot {
        Objects.requireNonNull(consistency, "consistency is required");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        results = results != null ? Collections.unmodifiableMap(new LinkedHashMap<>(results)) : Map.of();
    }

    public ValidationResult result(String nodeId) {
        return results.get(nodeId);
    }
}
