package com.report.validation.judge;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Invokes the judge with a per-call timeout and bounded retries with exponential backoff.
 * After the last attempt fails a {@link JudgeUnavailableException} is thrown; the caller
 * decides how to degrade.
 */
public class RetryingJudgeInvoker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryingJudgeInvoker.class);

    private static final long MAX_BACKOFF_MS = 5_000;

    private final JudgeOracle oracle;
    private final Duration callTimeout;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final MetricsService metricsService;
    private final ExecutorService callExecutor;
    private final AtomicLong invocations = new AtomicLong();

    public RetryingJudgeInvoker(JudgeOracle oracle, Duration callTimeout, int maxRetries,
                                Duration initialBackoff, MetricsService metricsService) {
        this.oracle = Objects.requireNonNull(oracle, "oracle is required");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout is required");
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        AtomicInteger threadCounter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "judge-call-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Evaluates the request, retrying failed or timed-out attempts.
     *
     * @throws JudgeUnavailableException once all attempts have failed
     */
    public JudgeVerdict evaluate(JudgeRequest request) {
        IssueCategory category = request.category();
        RuntimeException lastFailure = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                metricsService.incrementJudgeRetry(category);
                if (!sleepBackoff(attempt)) {
                    break;
                }
            }
            long start = System.nanoTime();
            try {
                JudgeVerdict verdict = callWithTimeout(request);
                metricsService.recordJudgeCall(category, true, Duration.ofNanos(System.nanoTime() - start));
                return verdict;
            } catch (RuntimeException e) {
                metricsService.recordJudgeCall(category, false, Duration.ofNanos(System.nanoTime() - start));
                lastFailure = e;
                log.warn("Judge attempt {}/{} failed for node {} ({}): {}",
                        attempt + 1, maxRetries + 1, request.nodeId(), category, e.getMessage());
            }
        }

        metricsService.incrementJudgeUnavailable(category);
        String reason = lastFailure != null ? lastFailure.getMessage() : "interrupted";
        throw new JudgeUnavailableException("Judge unavailable after " + (maxRetries + 1) + " attempt(s): " + reason,
                lastFailure);
    }

    /**
     * Total number of judge invocations issued, including retries.
     */
    public long getInvocationCount() {
        return invocations.get();
    }

    public String getJudgeVersion() {
        return oracle.getJudgeVersion();
    }

    public boolean isJudgeAvailable() {
        return oracle.isAvailable();
    }

    private JudgeVerdict callWithTimeout(JudgeRequest request) {
        invocations.incrementAndGet();
        CompletableFuture<JudgeVerdict> future = CompletableFuture.supplyAsync(() -> oracle.evaluate(request), callExecutor);
        try {
            JudgeVerdict verdict = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (verdict == null) {
                throw new JudgeUnavailableException("Judge returned no verdict");
            }
            return verdict;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new JudgeUnavailableException("Judge call timed out after " + callTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof JudgeUnavailableException jue) {
                throw jue;
            }
            throw new JudgeUnavailableException("Judge call failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new JudgeUnavailableException("Interrupted while waiting for judge", e);
        }
    }

    private boolean sleepBackoff(int attempt) {
        long backoffMs = Math.min(MAX_BACKOFF_MS, initialBackoff.toMillis() * (1L << (attempt - 1)));
        if (backoffMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
