package com.report.validation.reevaluation;

/**
 * What to do with a feedback approach after measuring its effect.
 */
public enum FeedbackRecommendation {
    CONTINUE,
    MODIFY,
    ABANDON
}
