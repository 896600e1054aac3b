package com.report.validation.cdi;

import com.report.validation.api.ReportValidator;
import com.report.validation.api.ValidationOptions;
import com.report.validation.cache.CacheConfig;
import com.report.validation.consistency.ConsistencyDepth;
import com.report.validation.judge.JudgeOracle;
import com.report.validation.judge.NoOpJudgeOracle;
import com.report.validation.judge.OllamaJudgeOracle;
import com.report.validation.review.ManualReviewQueue;
import com.report.validation.scoring.MetricWeights;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * CDI producer that wires report validation from MicroProfile Config properties.
 *
 * <p>Every property has a default, so an empty configuration yields a validator with
 * no judge (all judged metrics degrade). A typical setup:</p>
 * <pre>
 * report-validation:
 *   judge:
 *     provider: ollama
 *     ollama:
 *       base-url: http://localhost:11434
 *       model: llama3.2
 *   thresholds:
 *     confidence: 85
 *   workflow:
 *     max-iterations: 3
 * </pre>
 *
 * <p>Inject the validator directly:</p>
 * <pre>
 * &#64;Inject ReportValidator validator;
 * </pre>
 */
@ApplicationScoped
public class ReportValidationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReportValidationProducer.class);

    // ── Thresholds ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "report-validation.thresholds.confidence", defaultValue = "85")
    int confidenceThreshold;

    @Inject
    @ConfigProperty(name = "report-validation.thresholds.consistency", defaultValue = "85")
    int consistencyThreshold;

    @Inject
    @ConfigProperty(name = "report-validation.strict-mode", defaultValue = "false")
    boolean strictMode;

    // ── Metric Weights ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "report-validation.weights.accuracy", defaultValue = "0.30")
    double accuracyWeight;

    @Inject
    @ConfigProperty(name = "report-validation.weights.bias", defaultValue = "0.25")
    double biasWeight;

    @Inject
    @ConfigProperty(name = "report-validation.weights.clarity", defaultValue = "0.20")
    double clarityWeight;

    @Inject
    @ConfigProperty(name = "report-validation.weights.consistency", defaultValue = "0.15")
    double consistencyWeight;

    @Inject
    @ConfigProperty(name = "report-validation.weights.compliance", defaultValue = "0.10")
    double complianceWeight;

    // ── Workflow ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "report-validation.workflow.max-iterations", defaultValue = "5")
    int maxIterations;

    @Inject
    @ConfigProperty(name = "report-validation.workflow.max-iterations-without-improvement", defaultValue = "3")
    int maxIterationsWithoutImprovement;

    @Inject
    @ConfigProperty(name = "report-validation.workflow.validate-unmodified-nodes", defaultValue = "false")
    boolean validateUnmodifiedNodes;

    @Inject
    @ConfigProperty(name = "report-validation.workflow.consistency-depth", defaultValue = "SHALLOW")
    String consistencyDepth;

    @Inject
    @ConfigProperty(name = "report-validation.workflow.concurrency-cap", defaultValue = "5")
    int concurrencyCap;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "report-validation.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "report-validation.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "report-validation.cache.ttl-seconds", defaultValue = "86400")
    int cacheTtlSeconds;

    // ── Judge ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "report-validation.judge.provider", defaultValue = "noop")
    String judgeProvider;

    @Inject
    @ConfigProperty(name = "report-validation.judge.ollama.base-url", defaultValue = "http://localhost:11434")
    String ollamaBaseUrl;

    @Inject
    @ConfigProperty(name = "report-validation.judge.ollama.model", defaultValue = "llama3.2")
    String ollamaModel;

    @Inject
    @ConfigProperty(name = "report-validation.judge.timeout-seconds", defaultValue = "30")
    int judgeTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "report-validation.judge.max-retries", defaultValue = "2")
    int judgeMaxRetries;

    @Inject
    @ConfigProperty(name = "report-validation.judge.retry-backoff-millis", defaultValue = "200")
    long judgeRetryBackoffMillis;

    @Inject
    @ConfigProperty(name = "report-validation.judge.degraded-score", defaultValue = "40")
    int degradedMetricScore;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ValidationOptions validationOptions() {
        return ValidationOptions.builder()
                .confidenceThreshold(confidenceThreshold)
                .consistencyThreshold(consistencyThreshold)
                .strictMode(strictMode)
                .metricWeights(new MetricWeights(accuracyWeight, biasWeight, clarityWeight,
                        consistencyWeight, complianceWeight))
                .maxIterations(maxIterations)
                .maxIterationsWithoutImprovement(maxIterationsWithoutImprovement)
                .validateUnmodifiedNodes(validateUnmodifiedNodes)
                .consistencyDepth(ConsistencyDepth.valueOf(consistencyDepth.trim().toUpperCase(Locale.ROOT)))
                .concurrencyCap(concurrencyCap)
                .judgeTimeout(Duration.ofSeconds(judgeTimeoutSeconds))
                .judgeMaxRetries(judgeMaxRetries)
                .judgeRetryBackoff(Duration.ofMillis(judgeRetryBackoffMillis))
                .degradedMetricScore(degradedMetricScore)
                .build();
    }

    @Produces
    @ApplicationScoped
    public JudgeOracle judgeOracle() {
        return createJudgeOracle();
    }

    @Produces
    @ApplicationScoped
    public ReportValidator reportValidator(ValidationOptions options, JudgeOracle judgeOracle) {
        log.info("Producing ReportValidator: judge={} cache={}", judgeProvider, cacheEnabled);
        return ReportValidator.builder()
                .options(options)
                .judgeOracle(judgeOracle)
                .cacheConfig(new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled))
                .build();
    }

    public void closeValidator(@Disposes ReportValidator validator) {
        log.info("Closing ReportValidator");
        validator.close();
    }

    @Produces
    @ApplicationScoped
    public ManualReviewQueue manualReviewQueue(ReportValidator validator) {
        return validator.getReviewQueue();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    JudgeOracle createJudgeOracle() {
        if ("ollama".equalsIgnoreCase(judgeProvider)) {
            log.info("Judge enabled: provider=ollama model={}", ollamaModel);
            return OllamaJudgeOracle.builder()
                    .baseUrl(ollamaBaseUrl)
                    .model(ollamaModel)
                    .timeout(Duration.ofSeconds(judgeTimeoutSeconds))
                    .build();
        }
        if (!"noop".equalsIgnoreCase(judgeProvider)) {
            log.warn("Unknown judge provider '{}', falling back to NoOp", judgeProvider);
        }
        return new NoOpJudgeOracle();
    }
}
