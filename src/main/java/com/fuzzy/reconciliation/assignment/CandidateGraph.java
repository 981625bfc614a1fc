package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.RecordKey;
import com.fuzzy.reconciliation.core.model.Side;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Weighted bipartite graph of scored candidate pairs, indexed from both sides.
 * Adjacency is kept in id order so traversal is deterministic.
 */
public class CandidateGraph {

    private final Map<RecordId, NavigableMap<RecordId, Double>> byLeft = new HashMap<>();
    private final Map<RecordId, NavigableMap<RecordId, Double>> byRight = new HashMap<>();
    private int edgeCount;

    /**
     * Adds or re-scores an edge.
     *
     * @return the previous score of the edge, if it existed
     */
    public Optional<Double> put(CandidatePair pair) {
        Double previous = byLeft.computeIfAbsent(pair.leftId(), k -> new TreeMap<>())
                .put(pair.rightId(), pair.score());
        byRight.computeIfAbsent(pair.rightId(), k -> new TreeMap<>())
                .put(pair.leftId(), pair.score());
        if (previous == null) {
            edgeCount++;
        }
        return Optional.ofNullable(previous);
    }

    public boolean remove(RecordId leftId, RecordId rightId) {
        NavigableMap<RecordId, Double> rights = byLeft.get(leftId);
        if (rights == null || rights.remove(rightId) == null) {
            return false;
        }
        if (rights.isEmpty()) {
            byLeft.remove(leftId);
        }
        NavigableMap<RecordId, Double> lefts = byRight.get(rightId);
        lefts.remove(leftId);
        if (lefts.isEmpty()) {
            byRight.remove(rightId);
        }
        edgeCount--;
        return true;
    }

    /**
     * Removes every edge touching the record.
     *
     * @return the removed edges, in neighbour id order
     */
    public List<CandidatePair> removeAll(RecordKey key) {
        List<CandidatePair> edges = edgesOf(key);
        for (CandidatePair edge : edges) {
            remove(edge.leftId(), edge.rightId());
        }
        return edges;
    }

    public List<CandidatePair> edgesOf(RecordKey key) {
        NavigableMap<RecordId, Double> adjacent = adjacency(key);
        if (adjacent == null) {
            return List.of();
        }
        List<CandidatePair> edges = new ArrayList<>(adjacent.size());
        adjacent.forEach((other, score) -> edges.add(key.side() == Side.LEFT
                ? new CandidatePair(key.id(), other, score)
                : new CandidatePair(other, key.id(), score)));
        return edges;
    }

    public Set<RecordKey> neighbours(RecordKey key) {
        NavigableMap<RecordId, Double> adjacent = adjacency(key);
        Set<RecordKey> result = new TreeSet<>();
        if (adjacent != null) {
            Side other = key.side().opposite();
            for (RecordId id : adjacent.keySet()) {
                result.add(new RecordKey(other, id));
            }
        }
        return result;
    }

    public Optional<Double> score(RecordId leftId, RecordId rightId) {
        NavigableMap<RecordId, Double> rights = byLeft.get(leftId);
        return rights == null ? Optional.empty() : Optional.ofNullable(rights.get(rightId));
    }

    public int degree(RecordKey key) {
        NavigableMap<RecordId, Double> adjacent = adjacency(key);
        return adjacent == null ? 0 : adjacent.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    private NavigableMap<RecordId, Double> adjacency(RecordKey key) {
        return key.side() == Side.LEFT ? byLeft.get(key.id()) : byRight.get(key.id());
    }
}
