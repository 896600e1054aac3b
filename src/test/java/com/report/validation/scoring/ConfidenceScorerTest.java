package com.report.validation.scoring;

import com.report.validation.cache.CacheConfig;
import com.report.validation.cache.CacheKey;
import com.report.validation.cache.CaffeineValidationCache;
import com.report.validation.classification.NodeClassifierRegistry;
import com.report.validation.classification.NodeProfile;
import com.report.validation.compliance.DefaultComplianceRules;
import com.report.validation.core.model.Issue;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.MetricScore;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Severity;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.judge.JudgeFinding;
import com.report.validation.judge.JudgeVerdict;
import com.report.validation.judge.RetryingJudgeInvoker;
import com.report.validation.metrics.NoOpMetricsService;
import com.report.validation.support.ScriptedJudgeOracle;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfidenceScorer Tests")
class ConfidenceScorerTest {

    private ScriptedJudgeOracle oracle;
    private RetryingJudgeInvoker invoker;
    private CaffeineValidationCache cache;
    private ConfidenceScorer scorer;
    private final NodeClassifierRegistry classifiers = NodeClassifierRegistry.defaults();

    @BeforeEach
    void setUp() {
        oracle = ScriptedJudgeOracle.scoring(90);
        invoker = new RetryingJudgeInvoker(oracle, Duration.ofSeconds(2), 1, Duration.ZERO, new NoOpMetricsService());
        cache = new CaffeineValidationCache(CacheConfig.defaults());
        scorer = new ConfidenceScorer(invoker, DefaultComplianceRules.createDefaultEngine(), cache,
                MetricWeights.defaultWeights(), 40, new NoOpMetricsService());
    }

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    private ScoringContext contextFor(Node node) {
        NodeProfile profile = classifiers.classify(node);
        return ScoringContext.of("wf-1", profile, List.of());
    }

    @Nested
    @DisplayName("Aggregation")
    class AggregationTests {

        @Test
        @DisplayName("Should score all five metrics and aggregate by weight")
        void testFiveMetrics() {
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "The candidate plans work carefully.");

            ValidationResult result = scorer.score(node, contextFor(node));

            assertEquals(5, result.metricScores().size());
            assertEquals(100, result.metric(IssueCategory.COMPLIANCE).score());
            // 90 * 0.9 + 100 * 0.1
            assertEquals(91, result.confidence());
            assertEquals(ValidationResult.aggregate(result.metricScores().values()), result.confidence());
            assertEquals(4, oracle.getCallCount());
            assertEquals(0, oracle.getCallCount(IssueCategory.COMPLIANCE));
            assertEquals("scripted-v1", result.metadata().judgeVersion());
        }

        @Test
        @DisplayName("Should use per-category judge scores")
        void testPerCategoryScores() {
            oracle.respond(request -> switch (request.category()) {
                case ACCURACY -> JudgeVerdict.clean(80);
                case BIAS -> JudgeVerdict.clean(60);
                case CLARITY -> JudgeVerdict.clean(70);
                default -> JudgeVerdict.clean(100);
            });
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");

            ValidationResult result = scorer.score(node, contextFor(node));

            // 24 + 15 + 14 + 15 + 10
            assertEquals(78, result.confidence());
            assertEquals(70, result.metric(IssueCategory.BIAS).selfConfidence());
            assertEquals(70, result.metric(IssueCategory.ACCURACY).selfConfidence());
        }

        @Test
        @DisplayName("Should turn judge findings into issues and suggestions")
        void testFindings() {
            oracle.respond(request -> request.category() == IssueCategory.BIAS
                    ? new JudgeVerdict(55, List.of("gendered wording"), List.of(
                            new JudgeFinding(Severity.HIGH, "Gendered wording", List.of("he is assertive"), 7,
                                    "Use neutral wording"),
                            JudgeFinding.of(Severity.LOW, "Slightly one-sided", 3)))
                    : JudgeVerdict.clean(90));
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");

            ValidationResult result = scorer.score(node, contextFor(node));

            assertEquals(2, result.issues().size());
            Issue issue = result.issues().get(0);
            assertEquals(IssueCategory.BIAS, issue.category());
            assertEquals("insight_0", issue.nodeId());
            assertEquals(1, result.suggestions().size());
            assertEquals(issue.id(), result.suggestions().get(0).issueId());
            assertEquals(2, result.metric(IssueCategory.BIAS).issues().size());
        }

        @Test
        @DisplayName("Should include compliance issues from the rule engine")
        void testComplianceIssues() {
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Contact jane@example.com for notes.");

            ValidationResult result = scorer.score(node, contextFor(node));

            assertEquals(75, result.metric(IssueCategory.COMPLIANCE).score());
            assertEquals(1, result.issues().size());
            assertEquals(IssueCategory.COMPLIANCE, result.issues().get(0).category());
        }

        @Test
        @DisplayName("Should pass related content to the consistency judge only")
        void testRelatedContent() {
            Node scoring = TestReports.scoringNode("ocean_openness", "openness", 72);
            Node insight = TestReports.node("insight_0", NodeType.INSIGHT, "Openness is high.", "ocean_openness");
            oracle.respond(request -> {
                boolean hasRelated = !request.relatedContent().isEmpty();
                boolean expected = request.category() == IssueCategory.CONSISTENCY;
                return JudgeVerdict.clean(hasRelated == expected ? 90 : 10);
            });

            ScoringContext context = ScoringContext.forNode("wf-1", insight, classifiers.classify(insight),
                    Map.of("ocean_openness", scoring));
            ValidationResult result = scorer.score(insight, context);

            assertEquals(91, result.confidence());
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Should not call the judge again for unchanged content")
        void testIdempotentCaching() {
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");

            ValidationResult first = scorer.score(node, contextFor(node));
            ValidationResult second = scorer.score(node, contextFor(node));

            assertEquals(4, oracle.getCallCount());
            assertSame(first, second);
            assertEquals(first.metricScores(), second.metricScores());
            assertEquals(1, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Should rescore when content changes")
        void testContentChange() {
            Node original = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");
            Node revised = TestReports.node("insight_0", NodeType.INSIGHT, "Revised text.");

            scorer.score(original, contextFor(original));
            scorer.score(revised, contextFor(revised));

            assertEquals(8, oracle.getCallCount());
        }

        @Test
        @DisplayName("Should neither read nor write the cache when bypassing")
        void testBypass() {
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");

            scorer.score(node, contextFor(node).bypassingCache());
            scorer.score(node, contextFor(node).bypassingCache());

            assertEquals(8, oracle.getCallCount());
            assertTrue(cache.get(CacheKey.of(node, "scripted-v1")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Degraded scoring")
    class DegradedTests {

        @Test
        @DisplayName("Should fall back to the degraded score when the judge is down")
        void testDegraded() {
            oracle.setFailing(true);
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");

            ValidationResult result = scorer.score(node, contextFor(node));

            assertTrue(result.isDegraded());
            MetricScore accuracy = result.metric(IssueCategory.ACCURACY);
            assertTrue(accuracy.judgeUnavailable());
            assertEquals(40, accuracy.score());
            assertFalse(result.metric(IssueCategory.COMPLIANCE).judgeUnavailable());
            // 40 * 0.9 + 100 * 0.1
            assertEquals(46, result.confidence());
            // two attempts per judged metric
            assertEquals(8, oracle.getCallCount());
        }

        @Test
        @DisplayName("Should not cache degraded results")
        void testDegradedNotCached() {
            oracle.setFailing(true);
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");
            scorer.score(node, contextFor(node));

            oracle.setFailing(false);
            ValidationResult recovered = scorer.score(node, contextFor(node));

            assertFalse(recovered.isDegraded());
            assertEquals(91, recovered.confidence());
        }

        @Test
        @DisplayName("Should recover from a transient failure through retry")
        void testTransientFailure() {
            oracle.failNext(1);
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");

            ValidationResult result = scorer.score(node, contextFor(node));

            assertFalse(result.isDegraded());
            assertEquals(5, oracle.getCallCount());
        }
    }

    @Nested
    @DisplayName("Consistency re-check")
    class ConsistencyRecheckTests {

        @Test
        @DisplayName("Should re-judge only consistency for unchanged content")
        void testRescoreConsistency() {
            Node node = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");
            ValidationResult previous = scorer.score(node, contextFor(node));
            oracle.resetCounts();
            oracle.respond(request -> JudgeVerdict.clean(request.category() == IssueCategory.CONSISTENCY ? 50 : 10));

            ValidationResult rechecked = scorer.rescoreConsistency(node, previous, contextFor(node));

            assertEquals(1, oracle.getCallCount());
            assertEquals(1, oracle.getCallCount(IssueCategory.CONSISTENCY));
            assertEquals(50, rechecked.metric(IssueCategory.CONSISTENCY).score());
            assertEquals(90, rechecked.metric(IssueCategory.ACCURACY).score());
            // 27 + 22.5 + 18 + 7.5 + 10
            assertEquals(85, rechecked.confidence());
        }

        @Test
        @DisplayName("Should fall back to a full score when content changed")
        void testRescoreChangedContent() {
            Node original = TestReports.node("insight_0", NodeType.INSIGHT, "Text.");
            ValidationResult previous = scorer.score(original, contextFor(original));
            oracle.resetCounts();
            Node revised = TestReports.node("insight_0", NodeType.INSIGHT, "Other text.");

            scorer.rescoreConsistency(revised, previous, contextFor(revised));

            assertEquals(4, oracle.getCallCount());
        }
    }

    @Test
    @DisplayName("Should reject weights that do not sum to one")
    void testWeights() {
        assertThrows(IllegalArgumentException.class, () -> new MetricWeights(0.5, 0.5, 0.5, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new MetricWeights(-0.1, 0.4, 0.3, 0.3, 0.1));
        assertEquals(0.25, MetricWeights.defaultWeights().weightFor(IssueCategory.BIAS));
    }

    @Test
    @DisplayName("Should derive self-confidence from score bands")
    void testSelfConfidence() {
        assertEquals(90, ConfidenceScorer.selfConfidence(IssueCategory.BIAS, 81));
        assertEquals(70, ConfidenceScorer.selfConfidence(IssueCategory.BIAS, 80));
        assertEquals(90, ConfidenceScorer.selfConfidence(IssueCategory.ACCURACY, 86));
        assertEquals(80, ConfidenceScorer.selfConfidence(IssueCategory.CLARITY, 20));
        assertEquals(100, ConfidenceScorer.selfConfidence(IssueCategory.COMPLIANCE, 0));
    }
}
