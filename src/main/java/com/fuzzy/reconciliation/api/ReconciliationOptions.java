package com.fuzzy.reconciliation.api;

import com.fuzzy.reconciliation.cache.CacheConfig;

/**
 * Options for the reconciliation engine.
 * Configures the acceptance threshold, fan-out cap, scoring parallelism and batch limits.
 */
public class ReconciliationOptions {

    private static final double DEFAULT_THRESHOLD = 0.5;
    private static final int DEFAULT_MAX_CANDIDATES_PER_RECORD = 50;
    private static final int DEFAULT_SCORING_THREADS = 1;
    private static final int DEFAULT_MAX_BATCH_SIZE = 10_000;
    private static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;

    private final double threshold;
    private final int maxCandidatesPerRecord;
    private final int scoringThreads;
    private final boolean verifyFullStateEachBatch;
    private final int maxBatchSize;
    private final CacheConfig cacheConfig;
    private final long asyncTimeoutMs;

    private ReconciliationOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.maxCandidatesPerRecord = builder.maxCandidatesPerRecord;
        this.scoringThreads = builder.scoringThreads;
        this.verifyFullStateEachBatch = builder.verifyFullStateEachBatch;
        this.maxBatchSize = builder.maxBatchSize;
        this.cacheConfig = builder.cacheConfig;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
    }

    /**
     * Minimum confidence a pair needs to be accepted into the assignment.
     */
    public double getThreshold() {
        return threshold;
    }

    public int getMaxCandidatesPerRecord() {
        return maxCandidatesPerRecord;
    }

    public int getScoringThreads() {
        return scoringThreads;
    }

    public boolean isVerifyFullStateEachBatch() {
        return verifyFullStateEachBatch;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    /**
     * Creates default options.
     */
    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options: higher threshold and full-state verification after every batch.
     */
    public static ReconciliationOptions strict() {
        return builder()
                .threshold(0.8)
                .verifyFullStateEachBatch(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .threshold(threshold)
                .maxCandidatesPerRecord(maxCandidatesPerRecord)
                .scoringThreads(scoringThreads)
                .verifyFullStateEachBatch(verifyFullStateEachBatch)
                .maxBatchSize(maxBatchSize)
                .cacheConfig(cacheConfig)
                .asyncTimeoutMs(asyncTimeoutMs);
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int maxCandidatesPerRecord = DEFAULT_MAX_CANDIDATES_PER_RECORD;
        private int scoringThreads = DEFAULT_SCORING_THREADS;
        private boolean verifyFullStateEachBatch = false;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private CacheConfig cacheConfig = CacheConfig.disabled();
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;

        public Builder threshold(double threshold) {
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder maxCandidatesPerRecord(int maxCandidatesPerRecord) {
            if (maxCandidatesPerRecord <= 0) {
                throw new IllegalArgumentException("maxCandidatesPerRecord must be positive");
            }
            this.maxCandidatesPerRecord = maxCandidatesPerRecord;
            return this;
        }

        public Builder scoringThreads(int scoringThreads) {
            if (scoringThreads <= 0) {
                throw new IllegalArgumentException("scoringThreads must be positive");
            }
            this.scoringThreads = scoringThreads;
            return this;
        }

        public Builder verifyFullStateEachBatch(boolean verifyFullStateEachBatch) {
            this.verifyFullStateEachBatch = verifyFullStateEachBatch;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig != null ? cacheConfig : CacheConfig.disabled();
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be positive");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "threshold=" + threshold +
                ", maxCandidatesPerRecord=" + maxCandidatesPerRecord +
                ", scoringThreads=" + scoringThreads +
                ", verifyFullStateEachBatch=" + verifyFullStateEachBatch +
                ", maxBatchSize=" + maxBatchSize +
                ", cacheConfig=" + cacheConfig +
                ", asyncTimeoutMs=" + asyncTimeoutMs +
                '}';
    }
}
