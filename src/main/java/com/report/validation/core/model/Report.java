package com.report.validation.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The artifact under validation for one workflow.
 *
 * <p>Carries the current structured content, the iteration counter and the
 * validation results of every completed iteration. A report is workflow-scoped
 * and only touched by the thread driving that workflow.</p>
 */
public class Report {

    private final String workflowId;
    private final ReportKind kind;
    private JsonNode content;
    private int iteration;
    private final Map<Integer, Map<String, ValidationResult>> history = new LinkedHashMap<>();

    public Report(String workflowId, ReportKind kind, JsonNode content) {
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId is required");
        this.kind = kind != null ? kind : ReportKind.DEFAULT;
        this.content = Objects.requireNonNull(content, "content is required").deepCopy();
        this.iteration = 1;
    }

    public static Report of(ReportKind kind, JsonNode content) {
        return new Report(UUID.randomUUID().toString(), kind, content);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public ReportKind getKind() {
        return kind;
    }

    public JsonNode getContent() {
        return content;
    }

    public int getIteration() {
        return iteration;
    }

    /**
     * Replaces the content with a revised version and advances the iteration counter.
     */
    public void revise(JsonNode revisedContent) {
        this.content = Objects.requireNonNull(revisedContent, "revisedContent is required").deepCopy();
        this.iteration++;
    }

    /**
     * Records the current results for the current iteration, replacing any earlier record of it.
     */
    public void recordResults(Map<String, ValidationResult> results) {
        history.put(iteration, Collections.unmodifiableMap(new LinkedHashMap<>(results)));
    }

    public Map<String, ValidationResult> getResults(int forIteration) {
        return history.getOrDefault(forIteration, Map.of());
    }

    public Map<String, ValidationResult> getCurrentResults() {
        return getResults(iteration);
    }

    public Map<Integer, Map<String, ValidationResult>> getHistory() {
        return Collections.unmodifiableMap(history);
    }

    @Override
    public String toString() {
        return "Report{" +
                "workflowId='" + workflowId + '\'' +
                ", kind=" + kind +
                ", iteration=" + iteration +
                '}';
    }
}
