package com.fuzzy.reconciliation.incremental;

import com.fuzzy.reconciliation.assignment.Assignment;
import com.fuzzy.reconciliation.assignment.CandidateGraph;
import com.fuzzy.reconciliation.assignment.Match;
import com.fuzzy.reconciliation.assignment.StateCorruptionException;
import com.fuzzy.reconciliation.blocking.BlockingIndex;
import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.RecordKey;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.core.model.SourceRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The engine's single authoritative state: live records, blocking indexes, the candidate
 * graph and the assignment.
 *
 * <p>Every mutator takes the batch's {@link BatchTransaction} and registers its inverse, so a
 * rejected batch leaves no trace. Reads are unrestricted; writes must come from the single
 * batch writer.</p>
 */
public class ReconciliationState {

    private final Map<Side, Map<RecordId, SourceRecord>> records = new EnumMap<>(Side.class);
    private final Map<Side, BlockingIndex> indexes = new EnumMap<>(Side.class);
    private final Set<RecordKey> removed = new HashSet<>();
    private final CandidateGraph graph = new CandidateGraph();
    private final Assignment assignment = new Assignment();

    public ReconciliationState() {
        for (Side side : Side.values()) {
            records.put(side, new HashMap<>());
            indexes.put(side, new BlockingIndex(side));
        }
    }

    // ---- reads ----

    public Optional<SourceRecord> record(RecordKey key) {
        return Optional.ofNullable(records.get(key.side()).get(key.id()));
    }

    public boolean isActive(RecordKey key) {
        return records.get(key.side()).containsKey(key.id());
    }

    public RecordLifecycle lifecycle(RecordKey key) {
        if (isActive(key)) {
            return RecordLifecycle.ACTIVE;
        }
        return removed.contains(key) ? RecordLifecycle.REMOVED : RecordLifecycle.UNSEEN;
    }

    public Collection<SourceRecord> records(Side side) {
        return Collections.unmodifiableCollection(records.get(side).values());
    }

    public int activeCount(Side side) {
        return records.get(side).size();
    }

    public BlockingIndex index(Side side) {
        return indexes.get(side);
    }

    public CandidateGraph graph() {
        return graph;
    }

    public Assignment assignment() {
        return assignment;
    }

    // ---- transactional writes ----

    public void putRecord(SourceRecord record, BatchTransaction tx) {
        RecordKey key = record.key();
        boolean wasRemoved = removed.contains(key);
        tx.execute("activate " + key,
                () -> {
                    SourceRecord previous = records.get(key.side()).putIfAbsent(key.id(), record);
                    if (previous != null) {
                        throw new StateCorruptionException("Record " + key + " is already active");
                    }
                    removed.remove(key);
                },
                () -> {
                    records.get(key.side()).remove(key.id());
                    if (wasRemoved) {
                        removed.add(key);
                    }
                });
    }

    public SourceRecord removeRecord(RecordKey key, BatchTransaction tx) {
        SourceRecord existing = record(key).orElseThrow(() ->
                new StateCorruptionException("Cannot remove inactive record " + key));
        boolean wasRemoved = removed.contains(key);
        tx.execute("retire " + key,
                () -> {
                    records.get(key.side()).remove(key.id());
                    removed.add(key);
                },
                () -> {
                    records.get(key.side()).put(key.id(), existing);
                    if (!wasRemoved) {
                        removed.remove(key);
                    }
                });
        return existing;
    }

    public void index(RecordKey key, Set<String> keys, BatchTransaction tx) {
        BlockingIndex index = indexes.get(key.side());
        Set<String> previous = Set.copyOf(index.keysOf(key.id()));
        tx.execute("index " + key,
                () -> index.add(key.id(), keys),
                () -> index.add(key.id(), previous));
    }

    public void unindex(RecordKey key, BatchTransaction tx) {
        BlockingIndex index = indexes.get(key.side());
        Set<String> previous = Set.copyOf(index.keysOf(key.id()));
        tx.execute("unindex " + key,
                () -> index.remove(key.id()),
                () -> index.add(key.id(), previous));
    }

    public void addCandidate(CandidatePair pair, BatchTransaction tx) {
        Optional<Double> previous = graph.score(pair.leftId(), pair.rightId());
        tx.execute("candidate " + pair.leftId() + "/" + pair.rightId(),
                () -> graph.put(pair),
                () -> {
                    if (previous.isPresent()) {
                        graph.put(new CandidatePair(pair.leftId(), pair.rightId(), previous.get()));
                    } else {
                        graph.remove(pair.leftId(), pair.rightId());
                    }
                });
    }

    public List<CandidatePair> removeCandidates(RecordKey key, BatchTransaction tx) {
        List<CandidatePair> edges = graph.edgesOf(key);
        if (!edges.isEmpty()) {
            tx.execute("drop candidates of " + key,
                    () -> graph.removeAll(key),
                    () -> edges.forEach(graph::put));
        }
        return edges;
    }

    public void match(Match match, BatchTransaction tx) {
        tx.execute("match " + match.leftId() + "/" + match.rightId(),
                () -> assignment.match(match),
                () -> assignment.unmatchLeft(match.leftId()));
    }

    public Optional<Match> unmatch(RecordId leftId, BatchTransaction tx) {
        Optional<Match> current = assignment.matchOf(RecordKey.left(leftId));
        current.ifPresent(m -> tx.execute("unmatch " + leftId + "/" + m.rightId(),
                () -> assignment.unmatchLeft(leftId),
                () -> assignment.match(m)));
        return current;
    }

    // ---- invariant checks ----

    /**
     * Verifies the assignment around the given records: mirrored one-to-one entries, live
     * endpoints, a backing candidate edge with the same confidence.
     *
     * @throws StateCorruptionException on the first violation
     */
    public void verify(Collection<RecordKey> keys) {
        assignment.verify(keys);
        for (RecordKey key : keys) {
            Optional<Match> match = assignment.matchOf(key);
            if (match.isPresent()) {
                verifyMatch(match.get());
            }
        }
    }

    /**
     * Verifies every match in the assignment.
     */
    public void verifyAll() {
        assignment.verifyAll();
        for (Match match : assignment.matchesByLeft().values()) {
            verifyMatch(match);
        }
        for (Side side : Side.values()) {
            for (RecordId id : indexes.get(side).indexedIds()) {
                if (!records.get(side).containsKey(id)) {
                    throw new StateCorruptionException("Blocking index still holds removed record "
                            + side + ":" + id);
                }
            }
        }
    }

    private void verifyMatch(Match match) {
        if (!isActive(RecordKey.left(match.leftId())) || !isActive(RecordKey.right(match.rightId()))) {
            throw new StateCorruptionException("Match " + match + " references a removed record");
        }
        Optional<Double> edge = graph.score(match.leftId(), match.rightId());
        if (edge.isEmpty() || Double.compare(edge.get(), match.confidence()) != 0) {
            throw new StateCorruptionException("Match " + match + " is not backed by a candidate edge"
                    + edge.map(s -> " (edge score " + s + ")").orElse(""));
        }
    }
}
