package com.fuzzy.reconciliation.incremental;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensation journal for one batch. Every state mutation registers its inverse;
 * if the batch is not marked successful before close, the inverses run in reverse order
 * and the state returns to what it was when the batch started.
 *
 * <pre>
 * try (BatchTransaction tx = new BatchTransaction(batchId)) {
 *     tx.execute("index L:7", () -> index.add(id, keys), () -> index.remove(id));
 *     ...
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class BatchTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchTransaction.class);

    private final String batchId;
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;
    private boolean rolledBack = false;

    public BatchTransaction(String batchId) {
        this.batchId = batchId;
    }

    /**
     * Runs a mutation and registers its inverse. If the mutation itself throws, the
     * inverses registered so far run immediately and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction for batch " + batchId + " is already closed");
        }
        try {
            operation.run();
        } catch (RuntimeException e) {
            log.warn("Step '{}' of batch {} failed: {}. Rolling back.", description, batchId, e.getMessage());
            rollback();
            throw e;
        }
        compensations.push(new Compensation(description, compensation));
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    /**
     * Number of registered compensations, i.e. mutations applied so far.
     */
    public int size() {
        return compensations.size();
    }

    @Override
    public void close() {
        if (!closed && !success && !compensations.isEmpty()) {
            log.warn("Batch {} closed without success - rolling back {} steps", batchId, compensations.size());
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        rolledBack = true;
        while (!compensations.isEmpty()) {
            Compensation c = compensations.pop();
            try {
                c.action().run();
            } catch (RuntimeException e) {
                log.error("Compensation '{}' of batch {} failed: {}", c.description(), batchId, e.getMessage(), e);
            }
        }
    }

    private record Compensation(String description, Runnable action) {}
}
