package com.report.validation.extraction;

import com.report.validation.core.model.NodeType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Extracts a whole region as a single node, e.g. {@code executiveSummary}.
 */
public class SingleNodeRegionExtractor implements RegionExtractor {

    private final String region;
    private final String nodeId;
    private final NodeType nodeType;

    public SingleNodeRegionExtractor(String region, String nodeId, NodeType nodeType) {
        this.region = region;
        this.nodeId = nodeId;
        this.nodeType = nodeType;
    }

    @Override
    public String region() {
        return region;
    }

    @Override
    public List<NodeDraft> extract(JsonNode regionContent, List<ExtractionWarning> warnings) {
        if (regionContent.isTextual() && !regionContent.asText().isBlank()) {
            ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
            wrapped.put("text", regionContent.asText());
            return List.of(new NodeDraft(nodeId, nodeType, wrapped));
        }
        if ((regionContent.isObject() || regionContent.isArray()) && !regionContent.isEmpty()) {
            return List.of(new NodeDraft(nodeId, nodeType, regionContent));
        }
        warnings.add(ExtractionWarning.malformedNode(region, "Region is empty or has an unsupported shape"));
        return List.of();
    }
}
