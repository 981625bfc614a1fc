package com.fuzzy.reconciliation.cache;

import com.fuzzy.reconciliation.core.model.FieldBag;

import java.util.OptionalDouble;

/**
 * Memo of pair scores keyed by the two field bags.
 * Scores depend only on field content, so entries never go stale; eviction is purely
 * for memory.
 */
public interface ScoreCache {

    OptionalDouble get(FieldBag left, FieldBag right);

    void put(FieldBag left, FieldBag right, double score);

    void invalidateAll();

    CacheStats getStats();
}
