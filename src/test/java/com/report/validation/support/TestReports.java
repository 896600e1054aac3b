package com.report.validation.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeMetadata;
import com.report.validation.core.model.NodeType;

import java.util.Set;

/**
 * Report content and node fixtures shared by tests.
 */
public final class TestReports {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestReports() {
    }

    /**
     * Individual report with two traits, two insights, one recommendation and a summary.
     */
    public static JsonNode individualReport() {
        return json("""
                {
                  "reportId": "r-100",
                  "assessmentType": "individual",
                  "scores": {
                    "ocean": {
                      "raw": {"openness": 72, "conscientiousness": 64},
                      "percentile": {"openness": 81, "conscientiousness": 58},
                      "interpretation": {
                        "openness": "Curious and open to new approaches",
                        "conscientiousness": "Organised with some flexibility"
                      }
                    }
                  },
                  "insights": [
                    "The candidate shows strong openness, with an openness score of 72.",
                    {"title": "Planning", "text": "The candidate plans work carefully and meets deadlines."}
                  ],
                  "recommendations": [
                    {"action": "The candidate should lead one cross-team initiative per quarter.", "horizon": "6 months"}
                  ],
                  "executiveSummary": "The candidate combines curiosity with reliable planning."
                }
                """);
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test JSON", e);
        }
    }

    public static ObjectNode text(String value) {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        content.put("text", value);
        return content;
    }

    public static Node node(String id, NodeType type, String text, String... dependencies) {
        return Node.of(id, type, text(text),
                new NodeMetadata("general_assessment", Set.of(dependencies), 8, 5, "test"));
    }

    public static Node scoringNode(String id, String trait, int score) {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        content.put("trait", trait);
        content.put("score", score);
        return Node.of(id, NodeType.SCORING, content,
                new NodeMetadata("personality_assessment", Set.of(), 10, 6, "assessment_responses"));
    }
}
