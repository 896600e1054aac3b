package com.report.validation.api;

import com.report.validation.consistency.ConsistencyDepth;
import com.report.validation.scoring.MetricWeights;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for validation workflows: thresholds, metric weights, iteration budget,
 * re-evaluation strategy, concurrency and judge call policy.
 */
public class ValidationOptions {

    private static final int DEFAULT_CONFIDENCE_THRESHOLD = 85;
    private static final int DEFAULT_CONSISTENCY_THRESHOLD = 85;
    private static final int DEFAULT_MAX_ITERATIONS = 5;
    private static final int DEFAULT_CONCURRENCY_CAP = 5;
    private static final Duration DEFAULT_JUDGE_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_JUDGE_MAX_RETRIES = 2;
    private static final Duration DEFAULT_JUDGE_RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int DEFAULT_DEGRADED_METRIC_SCORE = 40;
    private static final int DEFAULT_MAX_ITERATIONS_WITHOUT_IMPROVEMENT = 3;

    private final int confidenceThreshold;
    private final int consistencyThreshold;
    private final MetricWeights metricWeights;
    private final boolean strictMode;
    private final int maxIterations;
    private final boolean validateUnmodifiedNodes;
    private final ConsistencyDepth consistencyDepth;
    private final int concurrencyCap;
    private final Duration judgeTimeout;
    private final int judgeMaxRetries;
    private final Duration judgeRetryBackoff;
    private final int degradedMetricScore;
    private final int maxIterationsWithoutImprovement;

    private ValidationOptions(Builder builder) {
        this.confidenceThreshold = builder.confidenceThreshold;
        this.consistencyThreshold = builder.consistencyThreshold;
        this.metricWeights = builder.metricWeights;
        this.strictMode = builder.strictMode;
        this.maxIterations = builder.maxIterations;
        this.validateUnmodifiedNodes = builder.validateUnmodifiedNodes;
        this.consistencyDepth = builder.consistencyDepth;
        this.concurrencyCap = builder.concurrencyCap;
        this.judgeTimeout = builder.judgeTimeout;
        this.judgeMaxRetries = builder.judgeMaxRetries;
        this.judgeRetryBackoff = builder.judgeRetryBackoff;
        this.degradedMetricScore = builder.degradedMetricScore;
        this.maxIterationsWithoutImprovement = builder.maxIterationsWithoutImprovement;
    }

    public int getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getConsistencyThreshold() {
        return consistencyThreshold;
    }

    public MetricWeights getMetricWeights() {
        return metricWeights;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public boolean isValidateUnmodifiedNodes() {
        return validateUnmodifiedNodes;
    }

    public ConsistencyDepth getConsistencyDepth() {
        return consistencyDepth;
    }

    public int getConcurrencyCap() {
        return concurrencyCap;
    }

    public Duration getJudgeTimeout() {
        return judgeTimeout;
    }

    public int getJudgeMaxRetries() {
        return judgeMaxRetries;
    }

    public Duration getJudgeRetryBackoff() {
        return judgeRetryBackoff;
    }

    public int getDegradedMetricScore() {
        return degradedMetricScore;
    }

    public int getMaxIterationsWithoutImprovement() {
        return maxIterationsWithoutImprovement;
    }

    public static ValidationOptions defaults() {
        return builder().build();
    }

    /**
     * Strict mode: high-severity issues and degraded metrics also block approval,
     * and every unmodified node is re-validated on re-evaluation.
     */
    public static ValidationOptions strict() {
        return builder()
                .strictMode(true)
                .validateUnmodifiedNodes(true)
                .consistencyDepth(ConsistencyDepth.DEEP)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .confidenceThreshold(confidenceThreshold)
                .consistencyThreshold(consistencyThreshold)
                .metricWeights(metricWeights)
                .strictMode(strictMode)
                .maxIterations(maxIterations)
                .validateUnmodifiedNodes(validateUnmodifiedNodes)
                .consistencyDepth(consistencyDepth)
                .concurrencyCap(concurrencyCap)
                .judgeTimeout(judgeTimeout)
                .judgeMaxRetries(judgeMaxRetries)
                .judgeRetryBackoff(judgeRetryBackoff)
                .degradedMetricScore(degradedMetricScore)
                .maxIterationsWithoutImprovement(maxIterationsWithoutImprovement);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ValidationOptions{" +
                "confidenceThreshold=" + confidenceThreshold +
                ", consistencyThreshold=" + consistencyThreshold +
                ", metricWeights=" + metricWeights +
                ", strictMode=" + strictMode +
                ", maxIterations=" + maxIterations +
                ", validateUnmodifiedNodes=" + validateUnmodifiedNodes +
                ", consistencyDepth=" + consistencyDepth +
                ", concurrencyCap=" + concurrencyCap +
                ", judgeTimeout=" + judgeTimeout +
                ", judgeMaxRetries=" + judgeMaxRetries +
                '}';
    }

    public static class Builder {
        private int confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private int consistencyThreshold = DEFAULT_CONSISTENCY_THRESHOLD;
        private MetricWeights metricWeights = MetricWeights.defaultWeights();
        private boolean strictMode = false;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private boolean validateUnmodifiedNodes = false;
        private ConsistencyDepth consistencyDepth = ConsistencyDepth.SHALLOW;
        private int concurrencyCap = DEFAULT_CONCURRENCY_CAP;
        private Duration judgeTimeout = DEFAULT_JUDGE_TIMEOUT;
        private int judgeMaxRetries = DEFAULT_JUDGE_MAX_RETRIES;
        private Duration judgeRetryBackoff = DEFAULT_JUDGE_RETRY_BACKOFF;
        private int degradedMetricScore = DEFAULT_DEGRADED_METRIC_SCORE;
        private int maxIterationsWithoutImprovement = DEFAULT_MAX_ITERATIONS_WITHOUT_IMPROVEMENT;

        public Builder confidenceThreshold(int confidenceThreshold) {
            validatePercent(confidenceThreshold, "confidenceThreshold");
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder consistencyThreshold(int consistencyThreshold) {
            validatePercent(consistencyThreshold, "consistencyThreshold");
            this.consistencyThreshold = consistencyThreshold;
            return this;
        }

        public Builder metricWeights(MetricWeights metricWeights) {
            this.metricWeights = Objects.requireNonNull(metricWeights, "metricWeights is required");
            return this;
        }

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be >= 1");
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder validateUnmodifiedNodes(boolean validateUnmodifiedNodes) {
            this.validateUnmodifiedNodes = validateUnmodifiedNodes;
            return this;
        }

        public Builder consistencyDepth(ConsistencyDepth consistencyDepth) {
            this.consistencyDepth = Objects.requireNonNull(consistencyDepth, "consistencyDepth is required");
            return this;
        }

        public Builder concurrencyCap(int concurrencyCap) {
            if (concurrencyCap < 1) {
                throw new IllegalArgumentException("concurrencyCap must be >= 1");
            }
            this.concurrencyCap = concurrencyCap;
            return this;
        }

        public Builder judgeTimeout(Duration judgeTimeout) {
            if (judgeTimeout == null || judgeTimeout.isNegative() || judgeTimeout.isZero()) {
                throw new IllegalArgumentException("judgeTimeout must be positive");
            }
            this.judgeTimeout = judgeTimeout;
            return this;
        }

        public Builder judgeMaxRetries(int judgeMaxRetries) {
            if (judgeMaxRetries < 0) {
                throw new IllegalArgumentException("judgeMaxRetries must be >= 0");
            }
            this.judgeMaxRetries = judgeMaxRetries;
            return this;
        }

        public Builder judgeRetryBackoff(Duration judgeRetryBackoff) {
            if (judgeRetryBackoff == null || judgeRetryBackoff.isNegative()) {
                throw new IllegalArgumentException("judgeRetryBackoff must not be negative");
            }
            this.judgeRetryBackoff = judgeRetryBackoff;
            return this;
        }

        public Builder degradedMetricScore(int degradedMetricScore) {
            validatePercent(degradedMetricScore, "degradedMetricScore");
            this.degradedMetricScore = degradedMetricScore;
            return this;
        }

        public Builder maxIterationsWithoutImprovement(int maxIterationsWithoutImprovement) {
            if (maxIterationsWithoutImprovement < 1) {
                throw new IllegalArgumentException("maxIterationsWithoutImprovement must be >= 1");
            }
            this.maxIterationsWithoutImprovement = maxIterationsWithoutImprovement;
            return this;
        }

        public ValidationOptions build() {
            if (degradedMetricScore >= confidenceThreshold) {
                throw new IllegalArgumentException("degradedMetricScore must be below confidenceThreshold");
            }
            return new ValidationOptions(this);
        }

        private void validatePercent(int value, String name) {
            if (value < 0 || value > 100) {
                throw new IllegalArgumentException(name + " must be between 0 and 100");
            }
        }
    }
}
