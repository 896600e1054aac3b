package com.report.validation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.report.validation.core.model.Report;
import com.report.validation.feedback.FeedbackPlan;

/**
 * The external content generator: applies a feedback plan and returns the revised
 * report content. How the plan is interpreted is up to the implementation.
 */
@FunctionalInterface
public interface ReportGenerator {

    /**
     * @param report current report, not modified by the call
     * @param plan   remediation plan for the current iteration
     * @return revised report content
     */
    JsonNode revise(Report report, FeedbackPlan plan);
}
