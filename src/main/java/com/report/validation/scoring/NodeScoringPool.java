package com.report.validation.scoring;

import com.report.validation.core.model.Node;
import com.report.validation.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded worker pool for scoring batches of nodes.
 *
 * <p>Node tasks are independent and may complete in any order; {@link #scoreAll} returns
 * only after the whole batch has finished, so callers aggregate over a consistent
 * snapshot. A task that throws is isolated: its node is reported as failed and siblings
 * are unaffected.</p>
 */
public class NodeScoringPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NodeScoringPool.class);

    private final ExecutorService executor;
    private final int concurrencyCap;

    public NodeScoringPool(int concurrencyCap) {
        if (concurrencyCap < 1) {
            throw new IllegalArgumentException("concurrencyCap must be >= 1");
        }
        this.concurrencyCap = concurrencyCap;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(concurrencyCap, r -> {
            Thread t = new Thread(r, "node-scorer-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs the scoring task for every node and waits for the full batch.
     *
     * @param nodes nodes to score
     * @param task  scoring function, typically a {@link ConfidenceScorer} call
     * @return per-node results in input order, plus the nodes whose task failed
     */
    public BatchOutcome scoreAll(List<Node> nodes, Function<Node, ValidationResult> task) {
        Map<String, CompletableFuture<ValidationResult>> futures = new LinkedHashMap<>();
        for (Node node : nodes) {
            futures.put(node.id(), CompletableFuture.supplyAsync(() -> task.apply(node), executor));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .exceptionally(t -> null)
                .join();

        Map<String, ValidationResult> results = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        futures.forEach((nodeId, future) -> {
            try {
                results.put(nodeId, future.join());
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Scoring failed for node {}: {}", nodeId, cause.toString(), cause);
                failures.put(nodeId, cause.toString());
            }
        });
        log.debug("Scored batch of {} node(s) with concurrency {}: {} failed",
                nodes.size(), concurrencyCap, failures.size());
        return new BatchOutcome(results, failures);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Results of one batch.
     *
     * @param results  successful results by node id, in input order
     * @param failures error description by node id for nodes whose task threw
     */
    public record BatchOutcome(Map<String, ValidationResult> results, Map<String, String> failures) {

        public BatchOutcome {
            results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
            failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        }
    }
}
