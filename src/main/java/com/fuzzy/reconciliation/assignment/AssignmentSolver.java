package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.CandidatePair;

import java.util.List;

/**
 * Computes a one-to-one matching over a candidate subgraph.
 * Implementations must be deterministic: the same request always yields the same pairs.
 */
public interface AssignmentSolver {

    /**
     * @return accepted pairs, each with a score at or above the request threshold,
     *         no record appearing twice
     */
    List<CandidatePair> solve(SolveRequest request);
}
