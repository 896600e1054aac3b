package com.report.validation.cdi;

import com.report.validation.api.ReportValidator;
import com.report.validation.api.ValidationOptions;
import com.report.validation.consistency.ConsistencyDepth;
import com.report.validation.judge.NoOpJudgeOracle;
import com.report.validation.judge.OllamaJudgeOracle;
import com.report.validation.scoring.MetricWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReportValidationProducerTest {

    private ReportValidationProducer producer;

    @BeforeEach
    void setUp() {
        // the values MicroProfile Config would inject from the property defaults
        producer = new ReportValidationProducer();
        producer.confidenceThreshold = 85;
        producer.consistencyThreshold = 85;
        producer.accuracyWeight = 0.30;
        producer.biasWeight = 0.25;
        producer.clarityWeight = 0.20;
        producer.consistencyWeight = 0.15;
        producer.complianceWeight = 0.10;
        producer.maxIterations = 5;
        producer.maxIterationsWithoutImprovement = 3;
        producer.consistencyDepth = "SHALLOW";
        producer.concurrencyCap = 5;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 50000;
        producer.cacheTtlSeconds = 86400;
        producer.judgeProvider = "noop";
        producer.ollamaBaseUrl = "http://localhost:11434";
        producer.ollamaModel = "llama3.2";
        producer.judgeTimeoutSeconds = 30;
        producer.judgeMaxRetries = 2;
        producer.judgeRetryBackoffMillis = 200;
        producer.degradedMetricScore = 40;
    }

    @Test
    @DisplayName("Should produce default options from default properties")
    void testDefaultOptions() {
        ValidationOptions options = producer.validationOptions();

        assertEquals(85, options.getConfidenceThreshold());
        assertEquals(MetricWeights.defaultWeights(), options.getMetricWeights());
        assertEquals(ConsistencyDepth.SHALLOW, options.getConsistencyDepth());
        assertEquals(Duration.ofMillis(200), options.getJudgeRetryBackoff());
    }

    @Test
    @DisplayName("Should map overridden properties onto options")
    void testOverrides() {
        producer.strictMode = true;
        producer.maxIterations = 3;
        producer.consistencyDepth = " deep ";
        producer.validateUnmodifiedNodes = true;

        ValidationOptions options = producer.validationOptions();

        assertTrue(options.isStrictMode());
        assertEquals(3, options.getMaxIterations());
        assertEquals(ConsistencyDepth.DEEP, options.getConsistencyDepth());
        assertTrue(options.isValidateUnmodifiedNodes());
    }

    @Test
    @DisplayName("Should fail fast on invalid configuration")
    void testInvalidConfiguration() {
        producer.accuracyWeight = 0.9;

        assertThrows(IllegalArgumentException.class, producer::validationOptions);
    }

    @Test
    @DisplayName("Should select the judge by provider")
    void testJudgeProvider() {
        assertInstanceOf(NoOpJudgeOracle.class, producer.createJudgeOracle());

        producer.judgeProvider = "OLLAMA";
        producer.ollamaModel = "mistral";
        assertInstanceOf(OllamaJudgeOracle.class, producer.createJudgeOracle());
        assertTrue(producer.createJudgeOracle().getJudgeVersion().contains("mistral"));

        producer.judgeProvider = "unknown";
        assertInstanceOf(NoOpJudgeOracle.class, producer.createJudgeOracle());
    }

    @Test
    @DisplayName("Should produce a validator sharing its review queue")
    void testValidator() {
        ReportValidator validator = producer.reportValidator(producer.validationOptions(), producer.judgeOracle());
        try {
            assertSame(validator.getReviewQueue(), producer.manualReviewQueue(validator));
            assertEquals(new NoOpJudgeOracle().getJudgeVersion(), validator.getJudgeVersion());
        } finally {
            producer.closeValidator(validator);
        }
    }
}
