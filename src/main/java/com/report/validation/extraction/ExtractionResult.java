package com.report.validation.extraction;

import com.report.validation.core.model.Node;

import java.util.List;
import java.util.Optional;

/**
 * Nodes and warnings produced by {@link NodeExtractor}.
 */
public record ExtractionResult(List<Node> nodes, List<ExtractionWarning> warnings, ExtractionMetadata metadata) {

    public ExtractionResult {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public Optional<Node> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }
}
