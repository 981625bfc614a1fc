package com.fuzzy.reconciliation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.batch.duration}: Timer (tag: outcome=applied|rejected)</li>
 *   <li>{@code reconciliation.batch.size}: DistributionSummary</li>
 *   <li>{@code reconciliation.region.size}: DistributionSummary</li>
 *   <li>{@code reconciliation.pairs.added} / {@code reconciliation.pairs.removed}: Counter</li>
 *   <li>{@code reconciliation.match.confidence}: DistributionSummary</li>
 *   <li>{@code reconciliation.fanout.exceeded}: Counter</li>
 *   <li>{@code reconciliation.pairs.malformed}: Counter</li>
 *   <li>{@code reconciliation.batch.rejected}: Counter</li>
 *   <li>{@code reconciliation.cache.hit} / {@code reconciliation.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer appliedTimer;
    private final Timer rejectedTimer;
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary regionSizeSummary;
    private final DistributionSummary confidenceSummary;
    private final Counter pairsAdded;
    private final Counter pairsRemoved;
    private final Counter fanOutExceeded;
    private final Counter malformedPairs;
    private final Counter batchesRejected;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.appliedTimer = batchTimer(registry, "applied");
        this.rejectedTimer = batchTimer(registry, "rejected");
        this.batchSizeSummary = DistributionSummary.builder("reconciliation.batch.size")
                .description("Number of delta events per batch")
                .register(registry);
        this.regionSizeSummary = DistributionSummary.builder("reconciliation.region.size")
                .description("Records re-solved per batch")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("reconciliation.match.confidence")
                .description("Confidence of accepted matches")
                .register(registry);
        this.pairsAdded = Counter.builder("reconciliation.pairs.added")
                .description("Matched pairs added to the assignment")
                .register(registry);
        this.pairsRemoved = Counter.builder("reconciliation.pairs.removed")
                .description("Matched pairs removed from the assignment")
                .register(registry);
        this.fanOutExceeded = Counter.builder("reconciliation.fanout.exceeded")
                .description("Records whose candidate set was truncated to the fan-out cap")
                .register(registry);
        this.malformedPairs = Counter.builder("reconciliation.pairs.malformed")
                .description("Candidate pairs dropped because a field could not be scored")
                .register(registry);
        this.batchesRejected = Counter.builder("reconciliation.batch.rejected")
                .description("Batches rejected and rolled back")
                .register(registry);
        this.cacheHits = Counter.builder("reconciliation.cache.hit")
                .description("Score cache hits")
                .register(registry);
        this.cacheMisses = Counter.builder("reconciliation.cache.miss")
                .description("Score cache misses")
                .register(registry);
    }

    private static Timer batchTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("reconciliation.batch.duration")
                .description("Time to apply a batch of deltas")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordBatchDuration(Duration duration, boolean applied) {
        (applied ? appliedTimer : rejectedTimer).record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordRegionSize(int size) {
        regionSizeSummary.record(size);
    }

    @Override
    public void incrementPairsAdded(int count) {
        pairsAdded.increment(count);
    }

    @Override
    public void incrementPairsRemoved(int count) {
        pairsRemoved.increment(count);
    }

    @Override
    public void recordMatchConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementFanOutExceeded() {
        fanOutExceeded.increment();
    }

    @Override
    public void incrementMalformedPair() {
        malformedPairs.increment();
    }

    @Override
    public void incrementBatchRejected() {
        batchesRejected.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }
}
