package com.report.validation.reevaluation;

/**
 * Size of a change, from content similarity: above 0.9 minor, above 0.7 moderate, otherwise major.
 */
public enum ChangeScope {
    MINOR,
    MODERATE,
    MAJOR;

    static ChangeScope ofSimilarity(double similarity) {
        if (similarity > 0.9) {
            return MINOR;
        }
        return similarity > 0.7 ? MODERATE : MAJOR;
    }
}
