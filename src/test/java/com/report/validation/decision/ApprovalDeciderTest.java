package com.report.validation.decision;

import com.report.validation.core.model.Issue;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.MetricScore;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Severity;
import com.report.validation.core.model.ValidationMetadata;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.core.model.ValidationStatus;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ApprovalDecider Tests")
class ApprovalDeciderTest {

    private final ApprovalDecider decider = new ApprovalDecider(85, 85, false);

    private static ValidationResult result(Node node, int confidence, Issue... issues) {
        return new ValidationResult(node.id(), node.contentHash(), confidence, Map.of(), List.of(issues), List.of(),
                ValidationMetadata.now("v1"));
    }

    private static Issue issue(String nodeId, Severity severity) {
        return Issue.of(nodeId, IssueCategory.BIAS, severity, severity.wireName() + " bias finding", List.of(), 5);
    }

    private static List<Node> nodes(int count) {
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            nodes.add(TestReports.node("insight_" + i, NodeType.INSIGHT, "Insight " + i + "."));
        }
        return nodes;
    }

    private static Map<String, ValidationResult> allAt(List<Node> nodes, int confidence) {
        Map<String, ValidationResult> results = new LinkedHashMap<>();
        nodes.forEach(n -> results.put(n.id(), result(n, confidence)));
        return results;
    }

    @Test
    @DisplayName("Should approve when every node meets the threshold with no issues")
    void testApproved() {
        List<Node> nodes = nodes(5);

        ApprovalDecision decision = decider.decide(nodes, allAt(nodes, 90), 100);

        assertTrue(decision.isApproved());
        assertEquals(90, decision.reportConfidence());
        assertTrue(decision.blockingReasons().isEmpty());
    }

    @Test
    @DisplayName("Should fail on a critical issue regardless of confidence")
    void testCriticalFails() {
        List<Node> nodes = nodes(5);
        Map<String, ValidationResult> results = allAt(nodes, 98);
        results.put("insight_2", result(nodes.get(2), 95, issue("insight_2", Severity.CRITICAL)));

        ApprovalDecision decision = decider.decide(nodes, results, 100);

        assertEquals(ValidationStatus.FAILED, decision.status());
        assertEquals(BlockingReason.Kind.CRITICAL_ISSUE, decision.blockingReasons().get(0).kind());
        assertEquals(Set.of("insight_2"), decision.blockingNodeIds());
    }

    @Nested
    @DisplayName("Revision required")
    class RevisionTests {

        @Test
        @DisplayName("Should require revision for a node below threshold")
        void testBelowThreshold() {
            List<Node> nodes = nodes(3);
            Map<String, ValidationResult> results = allAt(nodes, 90);
            results.put("insight_1", result(nodes.get(1), 70, issue("insight_1", Severity.MEDIUM)));

            ApprovalDecision decision = decider.decide(nodes, results, 100);

            assertEquals(ValidationStatus.REQUIRES_FURTHER_REVISION, decision.status());
            assertEquals(BlockingReason.Kind.BELOW_THRESHOLD, decision.blockingReasons().get(0).kind());
        }

        @Test
        @DisplayName("Should require revision for low consistency")
        void testLowConsistency() {
            List<Node> nodes = nodes(3);

            ApprovalDecision decision = decider.decide(nodes, allAt(nodes, 90), 80);

            assertEquals(ValidationStatus.REQUIRES_FURTHER_REVISION, decision.status());
            assertNull(decision.blockingReasons().get(0).nodeId());
            assertTrue(decision.blockingNodeIds().isEmpty());
        }

        @Test
        @DisplayName("Should never approve a node without a result")
        void testMissingResult() {
            List<Node> nodes = nodes(2);
            Map<String, ValidationResult> results = allAt(nodes, 95);
            results.remove("insight_0");

            ApprovalDecision decision = decider.decide(nodes, results, 100);

            assertEquals(ValidationStatus.REQUIRES_FURTHER_REVISION, decision.status());
            assertEquals(BlockingReason.Kind.MALFORMED_NODE, decision.blockingReasons().get(0).kind());
        }

        @Test
        @DisplayName("Should not approve an empty report")
        void testEmptyReport() {
            ApprovalDecision decision = decider.decide(List.of(), Map.of(), 100);

            assertEquals(ValidationStatus.REQUIRES_FURTHER_REVISION, decision.status());
            assertEquals(0, decision.reportConfidence());
        }
    }

    @Nested
    @DisplayName("Strict mode")
    class StrictModeTests {

        private final ApprovalDecider strict = new ApprovalDecider(85, 85, true);

        @Test
        @DisplayName("Should block on high severity issues only in strict mode")
        void testHighSeverity() {
            List<Node> nodes = nodes(2);
            Map<String, ValidationResult> results = allAt(nodes, 92);
            results.put("insight_0", result(nodes.get(0), 92, issue("insight_0", Severity.HIGH)));

            assertTrue(decider.decide(nodes, results, 100).isApproved());
            ApprovalDecision decision = strict.decide(nodes, results, 100);
            assertEquals(ValidationStatus.REQUIRES_FURTHER_REVISION, decision.status());
            assertEquals(BlockingReason.Kind.HIGH_SEVERITY_ISSUE, decision.blockingReasons().get(0).kind());
        }

        @Test
        @DisplayName("Should block on degraded scores only in strict mode")
        void testDegraded() {
            List<Node> nodes = nodes(1);
            Node node = nodes.get(0);
            Map<IssueCategory, MetricScore> scores = Map.of(
                    IssueCategory.ACCURACY, new MetricScore(IssueCategory.ACCURACY, 100, 0.9, List.of(), List.of(), 90, false),
                    IssueCategory.BIAS, MetricScore.unavailable(IssueCategory.BIAS, 40, 0.1, "down"));
            ValidationResult degraded = new ValidationResult(node.id(), node.contentHash(), 94, scores, List.of(),
                    List.of(), ValidationMetadata.now("v1"));

            assertTrue(decider.decide(nodes, Map.of(node.id(), degraded), 100).isApproved());
            assertEquals(BlockingReason.Kind.DEGRADED_SCORE,
                    strict.decide(nodes, Map.of(node.id(), degraded), 100).blockingReasons().get(0).kind());
        }
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1, 7, 42, 1234, 98765})
    @DisplayName("Should never approve a report holding a critical issue")
    void testApprovalMonotonicity(long seed) {
        Random random = new Random(seed);
        for (int round = 0; round < 50; round++) {
            List<Node> nodes = nodes(1 + random.nextInt(8));
            Map<String, ValidationResult> results = new LinkedHashMap<>();
            boolean anyCritical = false;
            for (Node node : nodes) {
                List<Issue> issues = new ArrayList<>();
                int issueCount = random.nextInt(3);
                for (int i = 0; i < issueCount; i++) {
                    Severity severity = Severity.values()[random.nextInt(Severity.values().length)];
                    anyCritical |= severity == Severity.CRITICAL;
                    issues.add(Issue.of(node.id(), IssueCategory.values()[i], severity, "finding " + i, List.of(), 5));
                }
                results.put(node.id(), result(node, 80 + random.nextInt(21), issues.toArray(new Issue[0])));
            }
            int consistency = 80 + random.nextInt(21);

            ApprovalDecision decision = decider.decide(nodes, results, consistency);

            if (anyCritical) {
                assertEquals(ValidationStatus.FAILED, decision.status());
            } else {
                assertNotEquals(ValidationStatus.FAILED, decision.status());
            }
        }
    }

    @Test
    @DisplayName("Should weight report confidence by node importance")
    void testReportConfidence() {
        Node scoring = TestReports.scoringNode("ocean_openness", "openness", 70);
        Node insight = TestReports.node("insight_0", NodeType.INSIGHT, "Insight.");

        int confidence = ApprovalDecider.reportConfidence(List.of(scoring, insight),
                List.of(result(scoring, 90), result(insight, 72)));

        // (90 * 10 + 72 * 8) / 18 = 82
        assertEquals(82, confidence);
    }
}
