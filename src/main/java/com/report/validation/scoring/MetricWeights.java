package com.report.validation.scoring;

import com.report.validation.core.model.IssueCategory;

/**
 * Weights of the five metrics in a node's confidence.
 */
public record MetricWeights(
        double accuracy,
        double bias,
        double clarity,
        double consistency,
        double compliance
) {
    public MetricWeights {
        if (accuracy < 0 || bias < 0 || clarity < 0 || consistency < 0 || compliance < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = accuracy + bias + clarity + consistency + compliance;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Accuracy 0.30, bias 0.25, clarity 0.20, consistency 0.15, compliance 0.10.
     */
    public static MetricWeights defaultWeights() {
        return new MetricWeights(0.30, 0.25, 0.20, 0.15, 0.10);
    }

    public double weightFor(IssueCategory category) {
        return switch (category) {
            case ACCURACY -> accuracy;
            case BIAS -> bias;
            case CLARITY -> clarity;
            case CONSISTENCY -> consistency;
            case COMPLIANCE -> compliance;
        };
    }
}
