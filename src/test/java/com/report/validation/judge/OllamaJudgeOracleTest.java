package com.report.validation.judge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.report.validation.classification.NodeClassifierRegistry;
import com.report.validation.classification.NodeProfile;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Severity;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OllamaJudgeOracleTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should include model and prompt revision in the judge version")
    void testJudgeVersion() {
        OllamaJudgeOracle oracle = OllamaJudgeOracle.builder().model("mistral").build();

        assertEquals("ollama/mistral/v1", oracle.getJudgeVersion());
    }

    @Nested
    @DisplayName("Verdict parsing")
    class ParsingTests {

        @Test
        @DisplayName("Should parse score, evidence and issues")
        void testParse() {
            String response = """
                    {"score": 72.6, "evidence": ["Mostly neutral"],
                     "issues": [
                       {"severity": "high", "description": "Age-coded wording", "evidence": ["energetic young"],
                        "priority": 8, "suggestedAction": "Describe behaviour instead"},
                       {"severity": "weird", "description": "Minor vagueness"},
                       {"severity": "low", "description": "  "}
                     ]}
                    """;

            JudgeVerdict verdict = OllamaJudgeOracle.parseVerdict(response, mapper);

            assertEquals(73, verdict.score());
            assertEquals(List.of("Mostly neutral"), verdict.evidence());
            assertEquals(2, verdict.findings().size());
            JudgeFinding first = verdict.findings().get(0);
            assertEquals(Severity.HIGH, first.severity());
            assertEquals(8, first.priority());
            assertEquals("Describe behaviour instead", first.suggestedAction());
            JudgeFinding second = verdict.findings().get(1);
            assertEquals(Severity.MEDIUM, second.severity());
            assertEquals(5, second.priority());
            assertNull(second.suggestedAction());
        }

        @Test
        @DisplayName("Should clamp out-of-range scores")
        void testClamp() {
            assertEquals(100, OllamaJudgeOracle.parseVerdict("{\"score\": 140}", mapper).score());
            assertEquals(0, OllamaJudgeOracle.parseVerdict("{\"score\": -3}", mapper).score());
        }

        @Test
        @DisplayName("Should reject invalid JSON and missing scores")
        void testInvalid() {
            assertThrows(JudgeUnavailableException.class,
                    () -> OllamaJudgeOracle.parseVerdict("not json", mapper));
            assertThrows(JudgeUnavailableException.class,
                    () -> OllamaJudgeOracle.parseVerdict("{\"score\": \"high\"}", mapper));
        }
    }

    @Test
    @DisplayName("Should build a prompt with criterion checks and related content")
    void testPrompt() {
        NodeProfile profile = NodeClassifierRegistry.defaults()
                .classify(TestReports.node("recommendation_0", NodeType.RECOMMENDATION, "Lead a project."));
        JudgeCriterion criterion = JudgeCriteria.forCategory(IssueCategory.CLARITY, profile);
        JudgeRequest request = new JudgeRequest("recommendation_0", NodeType.RECOMMENDATION,
                "Lead a project.", criterion, List.of("The candidate shows initiative."));

        String prompt = OllamaJudgeOracle.builder().build().buildPrompt(request);

        assertTrue(prompt.contains("recommendation section below for clarity"));
        assertTrue(prompt.contains("Criterion: clarity-recommendation"));
        assertTrue(prompt.contains("- Recommendations are concrete and actionable"));
        assertTrue(prompt.contains("Lead a project."));
        assertTrue(prompt.contains("- The candidate shows initiative."));
    }

    @Test
    @DisplayName("Should refuse to build a judge criterion for rule-based compliance")
    void testComplianceCriterion() {
        NodeProfile profile = NodeClassifierRegistry.defaults()
                .classify(TestReports.node("insight_0", NodeType.INSIGHT, "Text."));

        assertThrows(IllegalArgumentException.class,
                () -> JudgeCriteria.forCategory(IssueCategory.COMPLIANCE, profile));
    }

    @Test
    @DisplayName("Should never answer from the no-op judge")
    void testNoOpJudge() {
        NoOpJudgeOracle noOp = new NoOpJudgeOracle();

        assertFalse(noOp.isAvailable());
        assertThrows(JudgeUnavailableException.class, () -> noOp.evaluate(new JudgeRequest("n", NodeType.INSIGHT,
                "x", new JudgeCriterion(IssueCategory.BIAS, "bias-insight", List.of()), List.of())));
    }
}
