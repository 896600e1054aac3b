package com.report.validation.feedback;

import com.report.validation.classification.Criticality;

import java.util.Objects;

/**
 * Inputs to priority computation beyond the issue itself.
 *
 * @param confidenceThreshold target confidence; the gap to it raises priority above 20 points
 * @param urgency             urgency of the node, usually its profile's criticality
 */
public record FeedbackContext(int confidenceThreshold, Criticality urgency) {

    public FeedbackContext {
        Objects.requireNonNull(urgency, "urgency is required");
        if (confidenceThreshold < 0 || confidenceThreshold > 100) {
            throw new IllegalArgumentException("confidenceThreshold must be between 0 and 100");
        }
    }
}
