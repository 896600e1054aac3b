package com.report.validation.scoring;

import com.report.validation.cache.CacheKey;
import com.report.validation.cache.ValidationCache;
import com.report.validation.compliance.ComplianceReport;
import com.report.validation.compliance.ComplianceRuleEngine;
import com.report.validation.core.model.Issue;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.MetricScore;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.Suggestion;
import com.report.validation.core.model.ValidationMetadata;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.judge.JudgeCriteria;
import com.report.validation.judge.JudgeFinding;
import com.report.validation.judge.JudgeRequest;
import com.report.validation.judge.JudgeUnavailableException;
import com.report.validation.judge.JudgeVerdict;
import com.report.validation.judge.RetryingJudgeInvoker;
import com.report.validation.logging.LogContext;
import com.report.validation.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the five metric scores of a node and aggregates them into one confidence value.
 *
 * <p>Accuracy, bias, clarity and consistency are judged by the oracle; compliance is
 * computed by deterministic rules. Results are memoized by
 * {@code (nodeId, contentHash, judgeVersion)} so re-scoring unchanged content never
 * reaches the oracle.</p>
 *
 * <p>A judge failure never fails the node: after retries the metric gets the configured
 * degraded score and is flagged {@code judgeUnavailable}. Degraded results are not cached.</p>
 */
public class ConfidenceScorer {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private static final int RULE_SELF_CONFIDENCE = 100;
    private static final int DEFAULT_SELF_CONFIDENCE = 80;

    private final RetryingJudgeInvoker judge;
    private final ComplianceRuleEngine complianceEngine;
    private final ValidationCache cache;
    private final MetricWeights weights;
    private final int degradedScore;
    private final MetricsService metricsService;

    public ConfidenceScorer(RetryingJudgeInvoker judge, ComplianceRuleEngine complianceEngine,
                            ValidationCache cache, MetricWeights weights, int degradedScore,
                            MetricsService metricsService) {
        this.judge = Objects.requireNonNull(judge, "judge is required");
        this.complianceEngine = Objects.requireNonNull(complianceEngine, "complianceEngine is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.weights = Objects.requireNonNull(weights, "weights is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        if (degradedScore < 0 || degradedScore > 100) {
            throw new IllegalArgumentException("degradedScore must be between 0 and 100");
        }
        this.degradedScore = degradedScore;
    }

    /**
     * Scores a node on all five metrics, or returns the cached result for its content.
     */
    public ValidationResult score(Node node, ScoringContext context) {
        String judgeVersion = judge.getJudgeVersion();
        CacheKey key = CacheKey.of(node, judgeVersion);
        if (!context.bypassCache()) {
            Optional<ValidationResult> cached = cache.get(key);
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                log.debug("Cache hit for node {} (hash={})", node.id(), shortHash(node));
                return cached.get();
            }
            metricsService.recordCacheMiss();
        }

        try (LogContext ignored = LogContext.forNode(context.workflowId(), node.id(), node.type().wireName())) {
            long start = System.nanoTime();
            Map<IssueCategory, MetricOutcome> outcomes = new EnumMap<>(IssueCategory.class);
            for (IssueCategory category : IssueCategory.values()) {
                outcomes.put(category, category.isJudged()
                        ? judgeMetric(node, category, context)
                        : complianceMetric(node));
            }
            ValidationResult result = assemble(node, outcomes, judgeVersion);
            metricsService.recordNodeScoringDuration(node.type(), Duration.ofNanos(System.nanoTime() - start));
            metricsService.recordNodeConfidence(result.confidence());

            if (!context.bypassCache() && !result.isDegraded()) {
                cache.put(key, result);
            }
            log.debug("Scored node {} confidence={} issues={} degraded={}",
                    node.id(), result.confidence(), result.issues().size(), result.isDegraded());
            return result;
        }
    }

    /**
     * Re-judges only the consistency metric of a node whose own content is unchanged but
     * whose related nodes changed. The other metrics are carried over from the previous
     * result. The outcome depends on related content, so it is not cached.
     */
    public ValidationResult rescoreConsistency(Node node, ValidationResult previous, ScoringContext context) {
        if (previous == null || !previous.contentHash().equals(node.contentHash())) {
            return score(node, context);
        }
        try (LogContext ignored = LogContext.forNode(context.workflowId(), node.id(), node.type().wireName())) {
            Map<IssueCategory, MetricOutcome> outcomes = new EnumMap<>(IssueCategory.class);
            for (Map.Entry<IssueCategory, MetricScore> entry : previous.metricScores().entrySet()) {
                IssueCategory category = entry.getKey();
                if (category == IssueCategory.CONSISTENCY) {
                    continue;
                }
                List<Suggestion> carried = previous.suggestions().stream()
                        .filter(s -> s.category() == category)
                        .toList();
                outcomes.put(category, new MetricOutcome(entry.getValue(), carried));
            }
            outcomes.put(IssueCategory.CONSISTENCY, judgeMetric(node, IssueCategory.CONSISTENCY, context));
            ValidationResult result = assemble(node, outcomes, judge.getJudgeVersion());
            log.debug("Re-checked consistency of node {}: {} -> {}",
                    node.id(), previous.confidence(), result.confidence());
            return result;
        }
    }

    public String getJudgeVersion() {
        return judge.getJudgeVersion();
    }

    /**
     * Judge calls issued so far by the underlying invoker, retries included.
     */
    public long getJudgeInvocationCount() {
        return judge.getInvocationCount();
    }

    private MetricOutcome judgeMetric(Node node, IssueCategory category, ScoringContext context) {
        double weight = weights.weightFor(category);
        List<String> related = category == IssueCategory.CONSISTENCY
                ? context.relatedNodes().stream().map(Node::text).toList()
                : List.of();
        JudgeRequest request = new JudgeRequest(node.id(), node.type(), node.text(),
                JudgeCriteria.forCategory(category, context.profile()), related);
        JudgeVerdict verdict;
        try {
            verdict = judge.evaluate(request);
        } catch (JudgeUnavailableException e) {
            log.warn("Metric {} of node {} degraded: {}", category, node.id(), e.getMessage());
            return new MetricOutcome(MetricScore.unavailable(category, degradedScore, weight, e.getMessage()), List.of());
        }

        List<Issue> issues = new ArrayList<>();
        List<Suggestion> suggestions = new ArrayList<>();
        for (JudgeFinding finding : verdict.findings()) {
            Issue issue = Issue.of(node.id(), category, finding.severity(), finding.description(),
                    finding.evidence(), finding.priority());
            issues.add(issue);
            if (finding.suggestedAction() != null) {
                suggestions.add(new Suggestion(issue.id(), category, finding.suggestedAction(), 0));
            }
        }
        MetricScore score = new MetricScore(category, verdict.score(), weight, verdict.evidence(), issues,
                selfConfidence(category, verdict.score()), false);
        return new MetricOutcome(score, suggestions);
    }

    private MetricOutcome complianceMetric(Node node) {
        ComplianceReport report = complianceEngine.evaluate(node);
        MetricScore score = new MetricScore(IssueCategory.COMPLIANCE, report.score(),
                weights.weightFor(IssueCategory.COMPLIANCE), report.evidence(), report.issues(),
                RULE_SELF_CONFIDENCE, false);
        return new MetricOutcome(score, report.suggestions());
    }

    private ValidationResult assemble(Node node, Map<IssueCategory, MetricOutcome> outcomes, String judgeVersion) {
        Map<IssueCategory, MetricScore> scores = new EnumMap<>(IssueCategory.class);
        Map<String, Issue> issues = new LinkedHashMap<>();
        Map<String, Suggestion> suggestions = new LinkedHashMap<>();
        for (Map.Entry<IssueCategory, MetricOutcome> entry : outcomes.entrySet()) {
            MetricScore score = entry.getValue().score();
            scores.put(entry.getKey(), score);
            score.issues().forEach(i -> issues.putIfAbsent(i.id(), i));
            entry.getValue().suggestions().forEach(s -> suggestions.putIfAbsent(s.issueId(), s));
        }
        int confidence = ValidationResult.aggregate(scores.values());
        return new ValidationResult(node.id(), node.contentHash(), confidence, scores,
                new ArrayList<>(issues.values()), new ArrayList<>(suggestions.values()),
                ValidationMetadata.now(judgeVersion));
    }

    static int selfConfidence(IssueCategory category, int score) {
        return switch (category) {
            case BIAS -> score > 80 ? 90 : 70;
            case ACCURACY -> score > 85 ? 90 : 70;
            case COMPLIANCE -> RULE_SELF_CONFIDENCE;
            default -> DEFAULT_SELF_CONFIDENCE;
        };
    }

    private static String shortHash(Node node) {
        return node.contentHash().substring(0, 8);
    }

    private record MetricOutcome(MetricScore score, List<Suggestion> suggestions) {
    }
}
