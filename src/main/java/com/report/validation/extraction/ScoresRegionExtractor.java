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
 * Extracts the {@code scores} region: one node per personality trait under
 * {@code scores.ocean.raw} (joined with its percentile and interpretation), and one
 * node per entry of {@code scores.pillars}.
 */
public class ScoresRegionExtractor implements RegionExtractor {

    static final String REGION = "scores";

    private final ScoredMapRegionExtractor pillarExtractor =
            new ScoredMapRegionExtractor(REGION + ".pillars", "pillar_", "pillar");

    @Override
    public String region() {
        return REGION;
    }

    @Override
    public List<NodeDraft> extract(JsonNode regionContent, List<ExtractionWarning> warnings) {
        if (!regionContent.isObject()) {
            warnings.add(ExtractionWarning.malformedRegion(REGION, "Expected an object"));
            return List.of();
        }
        List<NodeDraft> drafts = new ArrayList<>();

        JsonNode ocean = regionContent.path("ocean");
        if (!ocean.isMissingNode()) {
            drafts.addAll(extractTraits(ocean, warnings));
        }
        JsonNode pillars = regionContent.path("pillars");
        if (!pillars.isMissingNode()) {
            drafts.addAll(pillarExtractor.extract(pillars, warnings));
        }
        if (ocean.isMissingNode() && pillars.isMissingNode()) {
            warnings.add(ExtractionWarning.malformedRegion(REGION, "Neither ocean nor pillars scores present"));
        }
        return drafts;
    }

    private List<NodeDraft> extractTraits(JsonNode ocean, List<ExtractionWarning> warnings) {
        JsonNode raw = ocean.path("raw");
        if (!raw.isObject()) {
            warnings.add(ExtractionWarning.malformedRegion(REGION + ".ocean", "Missing raw trait scores"));
            return List.of();
        }
        JsonNode percentiles = ocean.path("percentile");
        JsonNode interpretations = ocean.path("interpretation");

        List<NodeDraft> drafts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> traits = raw.fields();
        while (traits.hasNext()) {
            Map.Entry<String, JsonNode> trait = traits.next();
            String name = trait.getKey();
            if (!trait.getValue().isNumber()) {
                warnings.add(ExtractionWarning.malformedNode(REGION + ".ocean",
                        "Trait '" + name + "' has a non-numeric score"));
                continue;
            }
            ObjectNode content = JsonNodeFactory.instance.objectNode();
            content.put("trait", name);
            content.set("score", trait.getValue());
            if (percentiles.path(name).isNumber()) {
                content.set("percentile", percentiles.get(name));
            }
            if (interpretations.path(name).isTextual()) {
                content.set("interpretation", interpretations.get(name));
            }
            drafts.add(new NodeDraft("ocean_" + name, NodeType.SCORING, content));
        }
        return drafts;
    }
}
