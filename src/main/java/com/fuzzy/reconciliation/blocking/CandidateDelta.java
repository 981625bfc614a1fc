package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.CandidatePair;

import java.util.List;

/**
 * Candidate pairs gained and lost through a single record insertion or removal.
 */
public record CandidateDelta(List<CandidatePair> added, List<CandidatePair> removed) {

    public CandidateDelta {
        added = added != null ? List.copyOf(added) : List.of();
        removed = removed != null ? List.copyOf(removed) : List.of();
    }

    public static CandidateDelta added(List<CandidatePair> pairs) {
        return new CandidateDelta(pairs, List.of());
    }

    public static CandidateDelta removed(List<CandidatePair> pairs) {
        return new CandidateDelta(List.of(), pairs);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
