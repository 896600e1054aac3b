package com.report.validation.reevaluation;

import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeMetadata;
import com.report.validation.core.model.NodeType;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChangeDetectorTest {

    private ChangeDetector detector;
    private Node scoring;
    private Node insight;
    private Node recommendation;

    @BeforeEach
    void setUp() {
        detector = new ChangeDetector();
        scoring = TestReports.scoringNode("ocean_openness", "openness", 72);
        insight = TestReports.node("insight_0", NodeType.INSIGHT, "The candidate is curious.", "ocean_openness");
        recommendation = TestReports.node("recommendation_0", NodeType.RECOMMENDATION,
                "The candidate should join a research project.", "insight_0");
    }

    @Test
    @DisplayName("Should report nothing for identical iterations")
    void testNoChanges() {
        ChangeSet changes = detector.detect(List.of(scoring, insight), List.of(scoring, insight));

        assertTrue(changes.isEmpty());
        assertEquals(Set.of("ocean_openness", "insight_0"), changes.unchangedNodeIds());
    }

    @Test
    @DisplayName("Should require re-validation of a changed insight without consistency fan-out")
    void testContentChange() {
        Node revised = TestReports.node("insight_0", NodeType.INSIGHT, "The candidate is curious!",
                "ocean_openness");

        ChangeSet changes = detector.detect(List.of(scoring, insight, recommendation),
                List.of(scoring, revised, recommendation));

        ChangeAnalysis analysis = changes.changes().get(0);
        assertEquals(ChangeType.CONTENT, analysis.changeType());
        assertEquals(ChangeScope.MINOR, analysis.changeScope());
        assertTrue(analysis.similarity() > 0.9);
        assertEquals(List.of("recommendation_0"), analysis.affectedNodes());
        assertEquals(Set.of("insight_0"), changes.revalidationRequired());
        assertTrue(changes.consistencyDependents().isEmpty());
    }

    @Test
    @DisplayName("Should fan out consistency checks from a changed recommendation")
    void testRecommendationChange() {
        Node summary = TestReports.node("executive_summary", NodeType.SUMMARY, "Summary.", "recommendation_0");
        Node revised = TestReports.node("recommendation_0", NodeType.RECOMMENDATION,
                "Completely different advice about mentoring junior colleagues.", "insight_0");

        ChangeSet changes = detector.detect(List.of(insight, recommendation, summary),
                List.of(insight, revised, summary));

        assertEquals(ChangeScope.MAJOR, changes.changes().get(0).changeScope());
        assertEquals(Set.of("executive_summary"), changes.consistencyDependents());
    }

    @Test
    @DisplayName("Should treat new nodes as structural changes and record removed ones")
    void testStructureChange() {
        ChangeSet changes = detector.detect(List.of(scoring, recommendation), List.of(scoring, insight));

        ChangeAnalysis analysis = changes.changes().get(0);
        assertEquals("insight_0", analysis.nodeId());
        assertEquals(ChangeType.STRUCTURE, analysis.changeType());
        assertEquals(ChangeScope.MAJOR, analysis.changeScope());
        assertTrue(analysis.consistencyCheckRequired());
        assertEquals(Set.of("recommendation_0"), changes.removedNodeIds());
        assertFalse(changes.isEmpty());
    }

    @Test
    @DisplayName("Should not re-validate metadata-only changes")
    void testMetadataChange() {
        Node reweighted = insight.withMetadata(new NodeMetadata("general_assessment", Set.of(), 3, 5, "test"));

        ChangeSet changes = detector.detect(List.of(insight), List.of(reweighted));

        assertEquals(ChangeType.METADATA, changes.changes().get(0).changeType());
        assertTrue(changes.revalidationRequired().isEmpty());
        assertTrue(changes.contentChanged().isEmpty());
    }

    @Test
    @DisplayName("Should not list dependents that are re-scored anyway")
    void testDependentAlsoChanged() {
        Node newInsight = TestReports.node("insight_1", NodeType.INSIGHT, "New insight.", "ocean_openness");
        Node dependent = TestReports.node("recommendation_1", NodeType.RECOMMENDATION, "Act on it.", "insight_1");

        ChangeSet changes = detector.detect(List.of(scoring), List.of(scoring, newInsight, dependent));

        assertEquals(Set.of("insight_1", "recommendation_1"), changes.revalidationRequired());
        assertTrue(changes.consistencyDependents().isEmpty());
    }

    @Test
    @DisplayName("Should compute normalized edit-distance similarity")
    void testSimilarity() {
        assertEquals(3, EditDistanceSimilarity.distance("kitten", "sitting"));
        assertEquals(1.0, EditDistanceSimilarity.similarity("", ""));
        assertEquals(4.0 / 7.0, EditDistanceSimilarity.similarity("kitten", "sitting"), 0.0001);
    }
}
