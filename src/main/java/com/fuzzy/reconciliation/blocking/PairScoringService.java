package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.core.model.SourceRecord;
import com.fuzzy.reconciliation.metrics.MetricsService;
import com.fuzzy.reconciliation.metrics.NoOpMetricsService;
import com.fuzzy.reconciliation.similarity.MalformedRecordException;
import com.fuzzy.reconciliation.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores candidate pairs, optionally on a worker pool.
 *
 * <p>Scoring is pure and only reads records, so pairs of one record are scored in parallel
 * when {@code threads > 1}. Results are collected in input order, keeping the outcome
 * independent of thread scheduling. A pair whose scoring fails is dropped (score 0) and
 * never fails the caller.</p>
 */
public class PairScoringService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PairScoringService.class);

    private final SimilarityScorer scorer;
    private final MetricsService metrics;
    private final ExecutorService executor;

    public PairScoringService(SimilarityScorer scorer) {
        this(scorer, 1, new NoOpMetricsService());
    }

    public PairScoringService(SimilarityScorer scorer, int threads, MetricsService metrics) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.scorer = scorer;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.executor = threads > 1 ? Executors.newFixedThreadPool(threads, new ScorerThreadFactory()) : null;
    }

    /**
     * Scores {@code record} against each opposite-side record.
     *
     * @return pairs with a positive score, in the order of {@code opposites}
     */
    public List<CandidatePair> scoreAll(SourceRecord record, List<SourceRecord> opposites) {
        List<CandidatePair> pairs = new ArrayList<>(opposites.size());
        if (executor == null || opposites.size() < 2) {
            for (SourceRecord other : opposites) {
                score(record, other).ifPresent(pairs::add);
            }
            return pairs;
        }

        List<CompletableFuture<Optional<CandidatePair>>> futures = new ArrayList<>(opposites.size());
        for (SourceRecord other : opposites) {
            futures.add(CompletableFuture.supplyAsync(() -> score(record, other), executor));
        }
        for (CompletableFuture<Optional<CandidatePair>> future : futures) {
            future.join().ifPresent(pairs::add);
        }
        return pairs;
    }

    /**
     * Scores one pair; empty when the score is 0 or scoring failed.
     */
    public Optional<CandidatePair> score(SourceRecord a, SourceRecord b) {
        SourceRecord left = a.side() == Side.LEFT ? a : b;
        SourceRecord right = a.side() == Side.LEFT ? b : a;
        double score;
        try {
            score = scorer.score(left.fields(), right.fields());
        } catch (MalformedRecordException e) {
            metrics.incrementMalformedPair();
            log.warn("pair.malformed left={} right={} field={} reason={}",
                    left.id(), right.id(), e.getField(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            metrics.incrementMalformedPair();
            log.warn("pair.scoring.failed left={} right={} reason={}", left.id(), right.id(), e.toString());
            return Optional.empty();
        }
        if (Double.isNaN(score) || score <= 0.0) {
            return Optional.empty();
        }
        return Optional.of(new CandidatePair(left.id(), right.id(), Math.min(1.0, score)));
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
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

    private static final class ScorerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "reconciliation-scorer-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
