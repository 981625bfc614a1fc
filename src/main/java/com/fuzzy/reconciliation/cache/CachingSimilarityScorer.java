package com.fuzzy.reconciliation.cache;

import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.metrics.MetricsService;
import com.fuzzy.reconciliation.metrics.NoOpMetricsService;
import com.fuzzy.reconciliation.similarity.SimilarityScorer;

import java.util.OptionalDouble;

/**
 * Decorates a scorer with a {@link ScoreCache}. Failures of the delegate are not cached,
 * so a malformed pair is re-reported each time it is scored.
 */
public class CachingSimilarityScorer implements SimilarityScorer {

    private final SimilarityScorer delegate;
    private final ScoreCache cache;
    private final MetricsService metrics;

    public CachingSimilarityScorer(SimilarityScorer delegate, ScoreCache cache) {
        this(delegate, cache, new NoOpMetricsService());
    }

    public CachingSimilarityScorer(SimilarityScorer delegate, ScoreCache cache, MetricsService metrics) {
        this.delegate = delegate;
        this.cache = cache;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    @Override
    public double score(FieldBag left, FieldBag right) {
        OptionalDouble cached = cache.get(left, right);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.getAsDouble();
        }
        metrics.recordCacheMiss();
        double score = delegate.score(left, right);
        cache.put(left, right, score);
        return score;
    }

    public ScoreCache getCache() {
        return cache;
    }
}
