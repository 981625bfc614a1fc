package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.RecordKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CandidateGraphTest {

    private CandidateGraph graph;

    private static CandidatePair pair(long left, long right, double score) {
        return new CandidatePair(RecordId.of(left), RecordId.of(right), score);
    }

    @BeforeEach
    void setUp() {
        graph = new CandidateGraph();
        graph.put(pair(1, 10, 0.9));
        graph.put(pair(1, 2, 0.4));
        graph.put(pair(3, 10, 0.7));
    }

    @Test
    void edgesAreIndexedFromBothSides() {
        assertEquals(List.of(pair(1, 2, 0.4), pair(1, 10, 0.9)), graph.edgesOf(RecordKey.left(RecordId.of(1))));
        assertEquals(List.of(pair(1, 10, 0.9), pair(3, 10, 0.7)), graph.edgesOf(RecordKey.right(RecordId.of(10))));
        assertEquals(Set.of(RecordKey.left(RecordId.of(1)), RecordKey.left(RecordId.of(3))),
                graph.neighbours(RecordKey.right(RecordId.of(10))));
        assertEquals(3, graph.edgeCount());
    }

    @Test
    void putRescoresExistingEdge() {
        assertEquals(Optional.of(0.9), graph.put(pair(1, 10, 0.95)));
        assertEquals(Optional.of(0.95), graph.score(RecordId.of(1), RecordId.of(10)));
        assertEquals(3, graph.edgeCount());
    }

    @Test
    void removeAllDropsEveryEdgeOfRecord() {
        List<CandidatePair> removed = graph.removeAll(RecordKey.right(RecordId.of(10)));

        assertEquals(2, removed.size());
        assertEquals(1, graph.edgeCount());
        assertEquals(1, graph.degree(RecordKey.left(RecordId.of(1))));
        assertEquals(0, graph.degree(RecordKey.left(RecordId.of(3))));
        assertTrue(graph.neighbours(RecordKey.left(RecordId.of(3))).isEmpty());
    }

    @Test
    void removeMissingEdge() {
        assertFalse(graph.remove(RecordId.of(3), RecordId.of(2)));
        assertTrue(graph.remove(RecordId.of(3), RecordId.of(10)));
        assertTrue(graph.score(RecordId.of(3), RecordId.of(10)).isEmpty());
    }
}
