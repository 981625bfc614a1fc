package com.fuzzy.reconciliation.incremental;

/**
 * A batch could not be applied. The state was rolled back to its value before the batch
 * and no output was produced for it.
 */
public class BatchRejectedException extends RuntimeException {

    private final String batchId;

    public BatchRejectedException(String batchId, String message, Throwable cause) {
        super(message, cause);
        this.batchId = batchId;
    }

    public String getBatchId() {
        return batchId;
    }
}
