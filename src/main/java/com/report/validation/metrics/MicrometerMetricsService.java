package com.report.validation.metrics;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.WorkflowStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code report.judge.call} - Timer (tags: category, outcome)</li>
 *   <li>{@code report.judge.retry} - Counter (tag: category)</li>
 *   <li>{@code report.judge.unavailable} - Counter (tag: category)</li>
 *   <li>{@code report.node.scoring.duration} - Timer (tag: nodeType)</li>
 *   <li>{@code report.node.confidence} - DistributionSummary</li>
 *   <li>{@code report.cache.hit} / {@code report.cache.miss} - Counter</li>
 *   <li>{@code report.revalidation.nodes} - DistributionSummary (tag: disposition)</li>
 *   <li>{@code report.workflow.completed} - Counter (tag: status)</li>
 *   <li>{@code report.workflow.iterations} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary revalidatedSummary;
    private final DistributionSummary carriedForwardSummary;
    private final DistributionSummary iterationSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("report.node.confidence")
                .description("Distribution of node confidence values")
                .register(registry);
        this.revalidatedSummary = DistributionSummary.builder("report.revalidation.nodes")
                .description("Nodes per re-evaluation pass")
                .tag("disposition", "revalidated")
                .register(registry);
        this.carriedForwardSummary = DistributionSummary.builder("report.revalidation.nodes")
                .description("Nodes per re-evaluation pass")
                .tag("disposition", "carried_forward")
                .register(registry);
        this.iterationSummary = DistributionSummary.builder("report.workflow.iterations")
                .description("Iterations used per completed workflow")
                .register(registry);
        this.cacheHitCounter = Counter.builder("report.cache.hit")
                .description("Number of validation cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("report.cache.miss")
                .description("Number of validation cache misses")
                .register(registry);
    }

    @Override
    public void recordJudgeCall(IssueCategory category, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent("judge:" + category.name() + ":" + outcome, k ->
                Timer.builder("report.judge.call")
                        .description("Duration of judge oracle calls")
                        .tag("category", category.wireName())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementJudgeRetry(IssueCategory category) {
        counter("report.judge.retry", "Judge calls retried", "category", category.wireName()).increment();
    }

    @Override
    public void incrementJudgeUnavailable(IssueCategory category) {
        counter("report.judge.unavailable", "Metrics degraded after exhausting judge retries",
                "category", category.wireName()).increment();
    }

    @Override
    public void recordNodeScoringDuration(NodeType type, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("scoring:" + type.name(), k ->
                Timer.builder("report.node.scoring.duration")
                        .description("Duration of scoring a single node")
                        .tag("nodeType", type.wireName())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordNodeConfidence(int confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordRevalidation(int revalidatedNodes, int carriedForwardNodes) {
        revalidatedSummary.record(revalidatedNodes);
        carriedForwardSummary.record(carriedForwardNodes);
    }

    @Override
    public void recordWorkflowCompleted(WorkflowStatus status, int iterations) {
        counter("report.workflow.completed", "Completed validation workflows",
                "status", status.name().toLowerCase()).increment();
        iterationSummary.record(iterations);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
