package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.CandidatePair;

import java.util.Collection;
import java.util.List;

/**
 * Candidate subgraph handed to an {@link AssignmentSolver}. Every endpoint is free:
 * the caller has already released the matches inside the affected region and left out
 * edges towards records that stay matched elsewhere.
 *
 * @param candidates edges of the subgraph
 * @param threshold  minimum confidence a pair needs to be accepted
 */
public record SolveRequest(List<CandidatePair> candidates, double threshold) {

    public SolveRequest {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
    }

    public static SolveRequest of(Collection<CandidatePair> candidates, double threshold) {
        return new SolveRequest(List.copyOf(candidates), threshold);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
