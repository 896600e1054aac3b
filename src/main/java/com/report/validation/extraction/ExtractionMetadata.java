package com.report.validation.extraction;

import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.ReportKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one extraction pass.
 *
 * @param reportKind     the kind the extractor set was chosen for
 * @param regionsVisited regions that were present and handled, in visiting order
 * @param nodesByType    node counts per type
 */
public record ExtractionMetadata(
        ReportKind reportKind,
        List<String> regionsVisited,
        Map<NodeType, Integer> nodesByType
) {
    public ExtractionMetadata {
        regionsVisited = regionsVisited != null ? List.copyOf(regionsVisited) : List.of();
        nodesByType = nodesByType == null || nodesByType.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(nodesByType));
    }

    public int totalNodes() {
        return nodesByType.values().stream().mapToInt(Integer::intValue).sum();
    }
}
