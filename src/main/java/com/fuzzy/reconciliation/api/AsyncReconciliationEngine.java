package com.fuzzy.reconciliation.api;

import com.fuzzy.reconciliation.core.model.DeltaEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Submits batches to a {@link ReconciliationEngine} from a single worker thread, so batches
 * are applied in submission order without blocking the caller.
 *
 * <p>The timeout completes the returned future exceptionally; it does not cancel a batch that
 * is already running, which still commits or is rejected as a whole. Closing this wrapper
 * does not close the engine.</p>
 */
public class AsyncReconciliationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncReconciliationEngine.class);

    private final ReconciliationEngine engine;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncReconciliationEngine(ReconciliationEngine engine) {
        this(engine, engine.getOptions().getAsyncTimeoutMs());
    }

    public AsyncReconciliationEngine(ReconciliationEngine engine, long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "reconciliation-batch-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Queues a batch.
     *
     * @return a future completed with the outcome, or exceptionally with the
     *         {@link com.fuzzy.reconciliation.incremental.BatchRejectedException} or a timeout
     */
    public CompletableFuture<BatchOutcome> submit(List<DeltaEvent> batch) {
        Objects.requireNonNull(batch, "batch is required");
        List<DeltaEvent> copy = List.copyOf(batch);
        try {
            return CompletableFuture.supplyAsync(() -> engine.apply(copy), executor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("AsyncReconciliationEngine is closed", e));
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * Stops accepting batches and waits for queued ones to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Queued batches did not finish within {} ms, interrupting worker", timeoutMs);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
