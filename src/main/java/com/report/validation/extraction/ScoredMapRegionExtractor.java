package com.report.validation.extraction;

import com.report.validation.core.model.NodeType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Extracts one scoring node per entry of a {@code name -> score} map. Values may be a
 * bare number or an object carrying a numeric {@code score} field.
 * Used for pillar scores and executive leadership competencies.
 */
public class ScoredMapRegionExtractor implements RegionExtractor {

    private final String region;
    private final String idPrefix;
    private final String nameField;

    public ScoredMapRegionExtractor(String region, String idPrefix, String nameField) {
        this.region = region;
        this.idPrefix = idPrefix;
        this.nameField = nameField;
    }

    @Override
    public String region() {
        return region;
    }

    @Override
    public List<NodeDraft> extract(JsonNode regionContent, List<ExtractionWarning> warnings) {
        if (!regionContent.isObject()) {
            warnings.add(ExtractionWarning.malformedRegion(region, "Expected an object of scores"));
            return List.of();
        }
        List<NodeDraft> drafts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = regionContent.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            ObjectNode content = toScoredContent(entry.getKey(), entry.getValue());
            if (content == null) {
                warnings.add(ExtractionWarning.malformedNode(region,
                        "Entry '" + entry.getKey() + "' has no numeric score"));
                continue;
            }
            drafts.add(new NodeDraft(idPrefix + entry.getKey(), NodeType.SCORING, content));
        }
        return drafts;
    }

    private ObjectNode toScoredContent(String name, JsonNode value) {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        content.put(nameField, name);
        if (value.isNumber()) {
            content.set("score", value);
            return content;
        }
        if (value.isObject() && value.path("score").isNumber()) {
            value.fields().forEachRemaining(f -> content.set(f.getKey(), f.getValue()));
            return content;
        }
        return null;
    }
}
