package com.fuzzy.reconciliation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A scored candidate correspondence between a left and a right record.
 * Derived from two records and the scorer; cached in the candidate graph, never authoritative.
 */
public record CandidatePair(RecordId leftId, RecordId rightId, double score) {

    /**
     * Greedy acceptance order: score descending, then left id, then right id ascending.
     */
    public static final Comparator<CandidatePair> ACCEPTANCE_ORDER = Comparator
            .comparingDouble(CandidatePair::score).reversed()
            .thenComparing(CandidatePair::leftId)
            .thenComparing(CandidatePair::rightId);

    public CandidatePair {
        Objects.requireNonNull(leftId, "leftId is required");
        Objects.requireNonNull(rightId, "rightId is required");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
    }

    public static CandidatePair between(SourceRecord a, SourceRecord b, double score) {
        if (a.side() == b.side()) {
            throw new IllegalArgumentException("Candidate pair needs one record from each side");
        }
        return a.side() == Side.LEFT
                ? new CandidatePair(a.id(), b.id(), score)
                : new CandidatePair(b.id(), a.id(), score);
    }

    public boolean involves(RecordKey key) {
        return key.side() == Side.LEFT ? leftId.equals(key.id()) : rightId.equals(key.id());
    }
}
