package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.RecordId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy maximum-weight matching.
 *
 * <p>Candidates are visited in {@link CandidatePair#ACCEPTANCE_ORDER} (confidence descending,
 * then left id, then right id) and a pair is accepted when both endpoints are still free and
 * its confidence reaches the threshold. The total weight is at least half of the optimum
 * matching's weight, and the result is a pure function of the request.</p>
 */
public class GreedyAssignmentSolver implements AssignmentSolver {
    private static final Logger log = LoggerFactory.getLogger(GreedyAssignmentSolver.class);

    @Override
    public List<CandidatePair> solve(SolveRequest request) {
        if (request.isEmpty()) {
            return List.of();
        }
        List<CandidatePair> ordered = new ArrayList<>(request.candidates());
        ordered.sort(CandidatePair.ACCEPTANCE_ORDER);

        Set<RecordId> usedLeft = new HashSet<>();
        Set<RecordId> usedRight = new HashSet<>();
        List<CandidatePair> accepted = new ArrayList<>();
        for (CandidatePair pair : ordered) {
            if (pair.score() < request.threshold() || pair.score() <= 0.0) {
                // sorted descending: nothing further can pass
                break;
            }
            if (usedLeft.contains(pair.leftId()) || usedRight.contains(pair.rightId())) {
                continue;
            }
            usedLeft.add(pair.leftId());
            usedRight.add(pair.rightId());
            accepted.add(pair);
        }
        log.debug("Greedy solve accepted {} of {} candidates (threshold={})",
                accepted.size(), ordered.size(), request.threshold());
        return accepted;
    }
}
