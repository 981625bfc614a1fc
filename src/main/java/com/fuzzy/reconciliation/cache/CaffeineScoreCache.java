package com.fuzzy.reconciliation.cache;

import com.fuzzy.reconciliation.core.model.FieldBag;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Caffeine-backed score cache, bounded by size with idle expiry.
 */
public class CaffeineScoreCache implements ScoreCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineScoreCache.class);

    private final Cache<PairKey, Double> cache;

    public CaffeineScoreCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterAccess(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineScoreCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public OptionalDouble get(FieldBag left, FieldBag right) {
        Double score = cache.getIfPresent(new PairKey(left, right));
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    @Override
    public void put(FieldBag left, FieldBag right, double score) {
        cache.put(new PairKey(left, right), score);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached scores");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    record PairKey(FieldBag left, FieldBag right) {}
}
