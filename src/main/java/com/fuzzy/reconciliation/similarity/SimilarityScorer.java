package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldBag;

/**
 * Maps a pair of normalized field bags to a confidence between 0.0 and 1.0.
 * Implementations are pure and safe to call from several threads at once.
 */
public interface SimilarityScorer {

    /**
     * @throws MalformedRecordException if a compared field cannot be scored
     */
    double score(FieldBag left, FieldBag right);
}
