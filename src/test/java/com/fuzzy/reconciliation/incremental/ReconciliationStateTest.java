package com.fuzzy.reconciliation.incremental;

import com.fuzzy.reconciliation.assignment.Match;
import com.fuzzy.reconciliation.assignment.StateCorruptionException;
import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.RecordKey;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.core.model.SourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationStateTest {

    private static final RecordKey L1 = RecordKey.left(RecordId.of(1));
    private static final RecordKey R1 = RecordKey.right(RecordId.of(1));

    private ReconciliationState state;

    @BeforeEach
    void setUp() {
        state = new ReconciliationState();
    }

    private static SourceRecord record(RecordKey key) {
        return new SourceRecord(key.side(), key.id(), FieldBag.builder().text("name", "x").build());
    }

    private void commit(Consumer<BatchTransaction> work) {
        try (BatchTransaction tx = new BatchTransaction("test")) {
            work.accept(tx);
            tx.markSuccess();
        }
    }

    private void seedMatchedPair() {
        commit(tx -> {
            state.putRecord(record(L1), tx);
            state.putRecord(record(R1), tx);
            state.index(L1, Set.of("name:x"), tx);
            state.index(R1, Set.of("name:x"), tx);
            state.addCandidate(new CandidatePair(L1.id(), R1.id(), 0.8), tx);
            state.match(new Match(L1.id(), R1.id(), 0.8), tx);
        });
    }

    @Test
    void lifecycleTransitions() {
        assertEquals(RecordLifecycle.UNSEEN, state.lifecycle(L1));
        commit(tx -> state.putRecord(record(L1), tx));
        assertEquals(RecordLifecycle.ACTIVE, state.lifecycle(L1));
        commit(tx -> state.removeRecord(L1, tx));
        assertEquals(RecordLifecycle.REMOVED, state.lifecycle(L1));
        commit(tx -> state.putRecord(record(L1), tx));
        assertEquals(RecordLifecycle.ACTIVE, state.lifecycle(L1));
    }

    @Test
    @DisplayName("Activating an active record is refused")
    void doubleActivation() {
        commit(tx -> state.putRecord(record(L1), tx));
        assertThrows(StateCorruptionException.class, () -> commit(tx -> state.putRecord(record(L1), tx)));
    }

    @Test
    void removingInactiveRecordIsRefused() {
        assertThrows(StateCorruptionException.class, () -> commit(tx -> state.removeRecord(L1, tx)));
    }

    @Test
    @DisplayName("Rollback restores records, index, graph and assignment")
    void rollbackRestoresEverything() {
        seedMatchedPair();

        BatchTransaction tx = new BatchTransaction("rejected");
        state.unmatch(L1.id(), tx);
        state.removeCandidates(R1, tx);
        state.unindex(R1, tx);
        state.removeRecord(R1, tx);
        assertFalse(state.isActive(R1));
        tx.close();

        assertTrue(state.isActive(R1));
        assertEquals(RecordLifecycle.ACTIVE, state.lifecycle(R1));
        assertEquals(Set.of("name:x"), state.index(Side.RIGHT).keysOf(R1.id()));
        assertEquals(Optional.of(0.8), state.graph().score(L1.id(), R1.id()));
        assertEquals(R1.id(), state.assignment().matchOf(L1).orElseThrow().rightId());
        assertDoesNotThrow(state::verifyAll);
    }

    @Test
    void rescoredCandidateRollsBackToPreviousScore() {
        seedMatchedPair();

        BatchTransaction tx = new BatchTransaction("rejected");
        state.addCandidate(new CandidatePair(L1.id(), R1.id(), 0.3), tx);
        tx.close();

        assertEquals(Optional.of(0.8), state.graph().score(L1.id(), R1.id()));
    }

    @Test
    @DisplayName("Match without a backing edge fails verification")
    void unbackedMatch() {
        commit(tx -> {
            state.putRecord(record(L1), tx);
            state.putRecord(record(R1), tx);
            state.match(new Match(L1.id(), R1.id(), 0.8), tx);
        });

        assertThrows(StateCorruptionException.class, () -> state.verify(List.of(L1)));
        assertThrows(StateCorruptionException.class, state::verifyAll);
    }

    @Test
    @DisplayName("Match to a removed record fails verification")
    void matchToRemovedRecord() {
        seedMatchedPair();
        commit(tx -> state.removeRecord(R1, tx));

        assertThrows(StateCorruptionException.class, () -> state.verify(List.of(L1)));
    }

    @Test
    @DisplayName("Index entry of a removed record fails full verification")
    void staleIndexEntry() {
        commit(tx -> {
            state.putRecord(record(L1), tx);
            state.index(L1, Set.of("name:x"), tx);
            state.removeRecord(L1, tx);
        });

        assertThrows(StateCorruptionException.class, state::verifyAll);
    }

    @Test
    void unmatchOfUnmatchedRecordRegistersNothing() {
        BatchTransaction tx = new BatchTransaction("noop");
        assertTrue(state.unmatch(L1.id(), tx).isEmpty());
        assertEquals(0, tx.size());
        tx.close();
    }
}
