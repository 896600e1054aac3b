package com.report.validation.extraction;

import com.report.validation.core.model.NodeType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts one node per element of an array region, e.g. {@code insights[]} or
 * {@code recommendations[]}. Text elements are wrapped as {@code {"text": ...}}.
 */
public class ArrayRegionExtractor implements RegionExtractor {

    private final String region;
    private final String idPrefix;
    private final NodeType nodeType;

    public ArrayRegionExtractor(String region, String idPrefix, NodeType nodeType) {
        this.region = region;
        this.idPrefix = idPrefix;
        this.nodeType = nodeType;
    }

    @Override
    public String region() {
        return region;
    }

    @Override
    public List<NodeDraft> extract(JsonNode regionContent, List<ExtractionWarning> warnings) {
        if (!regionContent.isArray()) {
            warnings.add(ExtractionWarning.malformedRegion(region, "Expected an array"));
            return List.of();
        }
        List<NodeDraft> drafts = new ArrayList<>();
        for (int i = 0; i < regionContent.size(); i++) {
            JsonNode element = regionContent.get(i);
            String id = idPrefix + i;
            if (element.isTextual() && !element.asText().isBlank()) {
                ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
                wrapped.put("text", element.asText());
                drafts.add(new NodeDraft(id, nodeType, wrapped));
            } else if (element.isObject() && !element.isEmpty()) {
                drafts.add(new NodeDraft(id, nodeType, element));
            } else {
                warnings.add(ExtractionWarning.malformedNode(region,
                        "Element " + i + " is empty or not an object/text"));
            }
        }
        return drafts;
    }
}
