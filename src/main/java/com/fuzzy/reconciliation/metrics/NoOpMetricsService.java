package com.fuzzy.reconciliation.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBatchDuration(Duration duration, boolean applied) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordRegionSize(int size) {
    }

    @Override
    public void incrementPairsAdded(int count) {
    }

    @Override
    public void incrementPairsRemoved(int count) {
    }

    @Override
    public void recordMatchConfidence(double confidence) {
    }

    @Override
    public void incrementFanOutExceeded() {
    }

    @Override
    public void incrementMalformedPair() {
    }

    @Override
    public void incrementBatchRejected() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
