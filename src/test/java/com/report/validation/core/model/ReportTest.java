package com.report.validation.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportTest {

    @Test
    @DisplayName("Should start at iteration 1 and advance on revision")
    void testRevise() {
        Report report = new Report("wf-1", ReportKind.INDIVIDUAL, TestReports.individualReport());
        assertEquals(1, report.getIteration());

        report.revise(TestReports.json("{\"insights\": []}"));

        assertEquals(2, report.getIteration());
        assertTrue(report.getContent().has("insights"));
    }

    @Test
    @DisplayName("Should keep results per iteration")
    void testHistory() {
        Report report = new Report("wf-1", null, TestReports.individualReport());
        ValidationResult first = new ValidationResult("n1", "h1", 70, Map.of(), List.of(), List.of(),
                ValidationMetadata.now("v1"));
        ValidationResult second = new ValidationResult("n1", "h2", 90, Map.of(), List.of(), List.of(),
                ValidationMetadata.now("v1"));

        report.recordResults(Map.of("n1", first));
        report.revise(TestReports.individualReport());
        report.recordResults(Map.of("n1", second));

        assertEquals(ReportKind.DEFAULT, report.getKind());
        assertEquals(70, report.getResults(1).get("n1").confidence());
        assertEquals(90, report.getCurrentResults().get("n1").confidence());
        assertEquals(2, report.getHistory().size());
        assertTrue(report.getResults(5).isEmpty());
    }

    @Test
    @DisplayName("Should copy content on construction")
    void testContentCopied() {
        ObjectNode content = TestReports.text("Original");
        Report report = Report.of(ReportKind.EXECUTIVE, content);

        content.put("text", "Changed");

        assertEquals("Original", report.getContent().get("text").asText());
        assertNotNull(report.getWorkflowId());
    }
}
