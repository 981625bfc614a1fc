package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.RecordId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GreedyAssignmentSolver Tests")
class GreedyAssignmentSolverTest {

    private final GreedyAssignmentSolver solver = new GreedyAssignmentSolver();

    private static CandidatePair pair(long left, long right, double score) {
        return new CandidatePair(RecordId.of(left), RecordId.of(right), score);
    }

    @Test
    void emptyRequest() {
        assertEquals(List.of(), solver.solve(SolveRequest.of(List.of(), 0.5)));
    }

    @Test
    @DisplayName("Highest confidence pairs are accepted first")
    void highestFirst() {
        List<CandidatePair> accepted = solver.solve(SolveRequest.of(List.of(
                pair(0, 0, 0.6), pair(0, 1, 0.9), pair(1, 1, 0.8), pair(1, 0, 0.7)), 0.5));

        assertEquals(List.of(pair(0, 1, 0.9), pair(1, 0, 0.7)), accepted);
    }

    @Test
    @DisplayName("Ties break on left id, then right id")
    void tieBreaks() {
        List<CandidatePair> accepted = solver.solve(SolveRequest.of(List.of(
                pair(2, 5, 0.8), pair(1, 7, 0.8), pair(1, 5, 0.8), pair(2, 7, 0.8)), 0.5));

        assertEquals(List.of(pair(1, 5, 0.8), pair(2, 7, 0.8)), accepted);
    }

    @Test
    @DisplayName("Pairs below the threshold are never accepted")
    void threshold() {
        List<CandidatePair> accepted = solver.solve(SolveRequest.of(List.of(
                pair(0, 0, 0.49), pair(1, 1, 0.5)), 0.5));

        assertEquals(List.of(pair(1, 1, 0.5)), accepted);
    }

    @Test
    @DisplayName("Zero-score pairs are rejected even with a zero threshold")
    void zeroScore() {
        assertTrue(solver.solve(SolveRequest.of(List.of(pair(0, 0, 0.0)), 0.0)).isEmpty());
    }

    @Test
    @DisplayName("Greedy reaches half of the optimum on the adversarial square")
    void halfApproximation() {
        // optimum is 0-1 and 1-0 for 2.0; greedy takes 0-0 first and strands both others
        List<CandidatePair> accepted = solver.solve(SolveRequest.of(List.of(
                pair(0, 0, 1.0), pair(0, 1, 1.0 - 1e-9), pair(1, 0, 1.0 - 1e-9)), 0.1));

        double total = accepted.stream().mapToDouble(CandidatePair::score).sum();
        assertEquals(List.of(pair(0, 0, 1.0)), accepted);
        assertTrue(total >= 0.5 * 2.0 * (1.0 - 1e-9));
    }

    @Test
    @DisplayName("Result is one-to-one and independent of input order")
    void deterministicAndOneToOne() {
        Random random = new Random(42);
        List<CandidatePair> candidates = new ArrayList<>();
        for (int l = 0; l < 20; l++) {
            for (int r = 0; r < 20; r++) {
                if (random.nextInt(3) == 0) {
                    candidates.add(pair(l, r, Math.round(random.nextDouble() * 10) / 10.0));
                }
            }
        }
        List<CandidatePair> first = solver.solve(SolveRequest.of(candidates, 0.3));
        List<CandidatePair> shuffled = new ArrayList<>(candidates);
        Collections.shuffle(shuffled, new Random(7));
        List<CandidatePair> second = solver.solve(SolveRequest.of(shuffled, 0.3));

        assertEquals(first, second);
        Set<RecordId> lefts = new HashSet<>();
        Set<RecordId> rights = new HashSet<>();
        for (CandidatePair p : first) {
            assertTrue(lefts.add(p.leftId()));
            assertTrue(rights.add(p.rightId()));
            assertTrue(p.score() >= 0.3);
        }
    }

    @Test
    void thresholdValidated() {
        assertThrows(IllegalArgumentException.class, () -> SolveRequest.of(List.of(), 1.5));
    }
}
