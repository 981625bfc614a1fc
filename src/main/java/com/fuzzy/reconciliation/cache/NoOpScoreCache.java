package com.fuzzy.reconciliation.cache;

import com.fuzzy.reconciliation.core.model.FieldBag;

import java.util.OptionalDouble;

/**
 * Cache that stores nothing.
 */
public class NoOpScoreCache implements ScoreCache {

    @Override
    public OptionalDouble get(FieldBag left, FieldBag right) {
        return OptionalDouble.empty();
    }

    @Override
    public void put(FieldBag left, FieldBag right, double score) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
