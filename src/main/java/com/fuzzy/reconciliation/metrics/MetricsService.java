package com.fuzzy.reconciliation.metrics;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without any
 * registry configured.
 */
public interface MetricsService {

    void recordBatchDuration(Duration duration, boolean applied);

    void recordBatchSize(int size);

    void recordRegionSize(int size);

    void incrementPairsAdded(int count);

    void incrementPairsRemoved(int count);

    void recordMatchConfidence(double confidence);

    void incrementFanOutExceeded();

    void incrementMalformedPair();

    void incrementBatchRejected();

    void recordCacheHit();

    void recordCacheMiss();
}
