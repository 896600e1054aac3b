package com.report.validation.api;

import com.report.validation.cache.CacheConfig;
import com.report.validation.cache.NoOpValidationCache;
import com.report.validation.classification.Criticality;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Report;
import com.report.validation.core.model.ReportKind;
import com.report.validation.core.model.Severity;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.extraction.ExtractionResult;
import com.report.validation.feedback.Feedback;
import com.report.validation.feedback.FeedbackPlan;
import com.report.validation.judge.JudgeFinding;
import com.report.validation.judge.JudgeVerdict;
import com.report.validation.support.ScriptedJudgeOracle;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportValidatorTest {

    private ScriptedJudgeOracle oracle;
    private ReportValidator validator;

    @BeforeEach
    void setUp() {
        oracle = ScriptedJudgeOracle.scoring(90);
        validator = ReportValidator.builder()
                .judgeOracle(oracle)
                .options(ValidationOptions.builder().judgeRetryBackoff(Duration.ZERO).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        validator.close();
    }

    @Test
    @DisplayName("Should run each stage on its own")
    void testStages() {
        ExtractionResult extraction = validator.extract(
                new Report("wf-1", ReportKind.INDIVIDUAL, TestReports.individualReport()));
        List<Node> nodes = extraction.nodes();

        Map<String, ValidationResult> results = validator.scoreAll(nodes, "wf-1");

        assertEquals(6, results.size());
        results.values().forEach(r -> assertEquals(91, r.confidence()));
        assertEquals(100, validator.checkConsistency(nodes).score());
        assertEquals(Criticality.CRITICAL, validator.classify(nodes.get(0)).criticality());
        assertEquals("scripted-v1", validator.getJudgeVersion());
    }

    @Test
    @DisplayName("Should serve repeated scoring of unchanged content from the cache")
    void testCachedScoring() {
        Node node = TestReports.node("insight_0", NodeType.INSIGHT, "The candidate plans carefully.");

        ValidationResult first = validator.score(node, List.of(), "wf-1");
        ValidationResult second = validator.score(node, List.of(), "wf-2");

        assertSame(first, second);
        assertEquals(4, oracle.getCallCount());
        assertEquals(1, validator.getCache().getStats().hitCount());
    }

    @Test
    @DisplayName("Should synthesize and plan feedback for a node's issues")
    void testFeedback() {
        oracle.respond(request -> request.category() == IssueCategory.CLARITY
                ? new JudgeVerdict(50, List.of(), List.of(JudgeFinding.of(Severity.MEDIUM, "Jargon heavy", 5)))
                : JudgeVerdict.clean(90));
        Node node = TestReports.node("insight_0", NodeType.INSIGHT, "The candidate plans carefully.");

        ValidationResult result = validator.score(node, List.of(), "wf-1");
        List<Feedback> feedback = validator.synthesize(result, node);
        FeedbackPlan plan = validator.plan(feedback);

        assertEquals(1, feedback.size());
        assertEquals(IssueCategory.CLARITY, feedback.get(0).category());
        assertEquals(feedback, plan.recommendedSequence());
    }

    @Test
    @DisplayName("Should degrade every judged metric without a judge")
    void testNoJudge() {
        try (ReportValidator noJudge = ReportValidator.builder()
                .options(ValidationOptions.builder().judgeMaxRetries(0).build())
                .cacheConfig(CacheConfig.disabled())
                .build()) {
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "The candidate plans carefully.");

            ValidationResult result = noJudge.score(node, List.of(), "wf-1");

            assertTrue(result.isDegraded());
            assertEquals(46, result.confidence());
            assertInstanceOf(NoOpValidationCache.class, noJudge.getCache());
        }
    }
}
