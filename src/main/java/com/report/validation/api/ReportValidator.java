package com.report.validation.api;

import com.report.validation.cache.CacheConfig;
import com.report.validation.cache.CaffeineValidationCache;
import com.report.validation.cache.NoOpValidationCache;
import com.report.validation.cache.ValidationCache;
import com.report.validation.classification.NodeClassifierRegistry;
import com.report.validation.classification.NodeProfile;
import com.report.validation.compliance.ComplianceRuleEngine;
import com.report.validation.compliance.DefaultComplianceRules;
import com.report.validation.consistency.ConsistencyReport;
import com.report.validation.consistency.CrossNodeConsistencyChecker;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.Report;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.extraction.ExtractionResult;
import com.report.validation.extraction.ExtractorRegistry;
import com.report.validation.extraction.NodeExtractor;
import com.report.validation.feedback.Feedback;
import com.report.validation.feedback.FeedbackContext;
import com.report.validation.feedback.FeedbackPlan;
import com.report.validation.feedback.FeedbackSynthesizer;
import com.report.validation.judge.JudgeOracle;
import com.report.validation.judge.NoOpJudgeOracle;
import com.report.validation.judge.RetryingJudgeInvoker;
import com.report.validation.metrics.MetricsService;
import com.report.validation.metrics.NoOpMetricsService;
import com.report.validation.reevaluation.ChangeDetector;
import com.report.validation.reevaluation.ReEvaluationController;
import com.report.validation.reevaluation.RevalidationRequest;
import com.report.validation.reevaluation.RevalidationResult;
import com.report.validation.review.InMemoryManualReviewQueue;
import com.report.validation.review.ManualReviewQueue;
import com.report.validation.scoring.ConfidenceScorer;
import com.report.validation.scoring.NodeScoringPool;
import com.report.validation.scoring.ScoringContext;
import com.report.validation.tracing.NoOpTracingService;
import com.report.validation.tracing.TracingService;
import com.report.validation.workflow.ReportGenerator;
import com.report.validation.workflow.WorkflowHandle;
import com.report.validation.workflow.WorkflowOrchestrator;
import com.report.validation.workflow.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Main entry point for report validation.
 *
 * <p>Exposes each pipeline stage on its own (extraction, classification, scoring,
 * feedback synthesis and planning, re-evaluation) and the full bounded workflow.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (ReportValidator validator = ReportValidator.builder()
 *         .judgeOracle(OllamaJudgeOracle.createDefault())
 *         .options(ValidationOptions.defaults())
 *         .build()) {
 *
 *     Report report = Report.of(ReportKind.INDIVIDUAL, content);
 *     WorkflowResult result = validator.runWorkflow(report, generator);
 *     if (!result.isApproved()) {
 *         log.warn(result.explain());
 *     }
 * }
 * </pre>
 */
public class ReportValidator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReportValidator.class);

    private final ValidationOptions options;
    private final NodeExtractor extractor;
    private final NodeClassifierRegistry classifiers;
    private final RetryingJudgeInvoker judgeInvoker;
    private final ValidationCache cache;
    private final ConfidenceScorer scorer;
    private final NodeScoringPool scoringPool;
    private final CrossNodeConsistencyChecker consistencyChecker;
    private final FeedbackSynthesizer synthesizer;
    private final ReEvaluationController reEvaluationController;
    private final WorkflowOrchestrator orchestrator;
    private final ManualReviewQueue reviewQueue;
    private final ExecutorService workflowExecutor;

    private ReportValidator(Builder builder) {
        this.options = builder.options;
        this.extractor = new NodeExtractor(builder.extractorRegistry != null
                ? builder.extractorRegistry : ExtractorRegistry.defaults());
        this.classifiers = builder.classifierRegistry != null
                ? builder.classifierRegistry : NodeClassifierRegistry.defaults();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        JudgeOracle oracle = builder.judgeOracle != null ? builder.judgeOracle : new NoOpJudgeOracle();
        if (builder.judgeOracle == null) {
            log.warn("No judge oracle configured; every judged metric will be degraded");
        }
        this.cache = builder.cache != null ? builder.cache : createCache(builder.cacheConfig);
        ComplianceRuleEngine complianceEngine = builder.complianceEngine != null
                ? builder.complianceEngine : DefaultComplianceRules.createDefaultEngine();

        this.judgeInvoker = new RetryingJudgeInvoker(oracle, options.getJudgeTimeout(),
                options.getJudgeMaxRetries(), options.getJudgeRetryBackoff(), metricsService);
        this.scorer = new ConfidenceScorer(judgeInvoker, complianceEngine, cache, options.getMetricWeights(),
                options.getDegradedMetricScore(), metricsService);
        this.scoringPool = new NodeScoringPool(options.getConcurrencyCap());
        this.consistencyChecker = new CrossNodeConsistencyChecker();
        this.synthesizer = new FeedbackSynthesizer();
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryManualReviewQueue();
        this.reEvaluationController = new ReEvaluationController(scorer, classifiers, scoringPool,
                consistencyChecker, new ChangeDetector(), options, metricsService, tracingService);
        this.orchestrator = new WorkflowOrchestrator(extractor, classifiers, scorer, scoringPool,
                consistencyChecker, synthesizer, reEvaluationController, reviewQueue, options,
                metricsService, tracingService);

        AtomicInteger threadCounter = new AtomicInteger();
        this.workflowExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "report-workflow-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("ReportValidator created: judge={}, {}", judgeInvoker.getJudgeVersion(), options);
    }

    private static ValidationCache createCache(CacheConfig config) {
        CacheConfig effective = config != null ? config : CacheConfig.defaults();
        return effective.enabled() ? new CaffeineValidationCache(effective) : new NoOpValidationCache();
    }

    public ExtractionResult extract(Report report) {
        return extractor.extract(report);
    }

    public NodeProfile classify(Node node) {
        return classifiers.classify(node);
    }

    /**
     * Scores one node. Related nodes are used by the consistency metric.
     */
    public ValidationResult score(Node node, List<Node> relatedNodes, String workflowId) {
        return scorer.score(node, ScoringContext.of(workflowId, classifiers.classify(node), relatedNodes));
    }

    /**
     * Scores every node of an extraction on the bounded pool, waiting for the whole batch.
     */
    public Map<String, ValidationResult> scoreAll(List<Node> nodes, String workflowId) {
        Map<String, Node> byId = nodes.stream().collect(Collectors.toMap(Node::id, Function.identity(), (a, b) -> a));
        return scoringPool.scoreAll(nodes, node ->
                scorer.score(node, ScoringContext.forNode(workflowId, node, classifiers.classify(node), byId)))
                .results();
    }

    public ConsistencyReport checkConsistency(List<Node> nodes) {
        return consistencyChecker.checkAll(nodes);
    }

    /**
     * Feedback for one node's issues, with urgency taken from the node's profile.
     */
    public List<Feedback> synthesize(ValidationResult result, Node node) {
        return synthesizer.synthesize(result, node,
                new FeedbackContext(options.getConfidenceThreshold(), classifiers.classify(node).criticality()));
    }

    public FeedbackPlan plan(List<Feedback> feedbackItems) {
        return synthesizer.plan(feedbackItems);
    }

    public RevalidationResult revalidate(RevalidationRequest request) {
        return reEvaluationController.revalidate(request);
    }

    public WorkflowResult runWorkflow(Report report, ReportGenerator generator) {
        return orchestrator.run(report, generator);
    }

    public WorkflowResult runWorkflow(Report report, ReportGenerator generator, WorkflowHandle handle) {
        return orchestrator.run(report, generator, handle);
    }

    /**
     * Runs the workflow on a background thread. Cancel through the returned handle.
     */
    public AsyncWorkflow runWorkflowAsync(Report report, ReportGenerator generator) {
        WorkflowHandle handle = new WorkflowHandle(report.getWorkflowId());
        CompletableFuture<WorkflowResult> future = CompletableFuture.supplyAsync(
                () -> orchestrator.run(report, generator, handle), workflowExecutor);
        return new AsyncWorkflow(handle, future);
    }

    public ManualReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    public ValidationCache getCache() {
        return cache;
    }

    public ValidationOptions getOptions() {
        return options;
    }

    public String getJudgeVersion() {
        return judgeInvoker.getJudgeVersion();
    }

    @Override
    public void close() {
        workflowExecutor.shutdownNow();
        scoringPool.close();
        judgeInvoker.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A workflow started with {@link #runWorkflowAsync}.
     */
    public record AsyncWorkflow(WorkflowHandle handle, CompletableFuture<WorkflowResult> result) {
    }

    public static class Builder {
        private JudgeOracle judgeOracle;
        private ValidationCache cache;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ManualReviewQueue reviewQueue;
        private ExtractorRegistry extractorRegistry;
        private NodeClassifierRegistry classifierRegistry;
        private ComplianceRuleEngine complianceEngine;
        private ValidationOptions options = ValidationOptions.defaults();

        public Builder judgeOracle(JudgeOracle judgeOracle) {
            this.judgeOracle = judgeOracle;
            return this;
        }

        /**
         * Shares a cache between validators. Takes precedence over {@link #cacheConfig}.
         */
        public Builder cache(ValidationCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder reviewQueue(ManualReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder extractorRegistry(ExtractorRegistry extractorRegistry) {
            this.extractorRegistry = extractorRegistry;
            return this;
        }

        public Builder classifierRegistry(NodeClassifierRegistry classifierRegistry) {
            this.classifierRegistry = classifierRegistry;
            return this;
        }

        public Builder complianceEngine(ComplianceRuleEngine complianceEngine) {
            this.complianceEngine = complianceEngine;
            return this;
        }

        public Builder options(ValidationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public ReportValidator build() {
            return new ReportValidator(this);
        }
    }
}
