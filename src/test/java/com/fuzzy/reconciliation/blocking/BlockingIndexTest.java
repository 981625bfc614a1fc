package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BlockingIndexTest {

    private BlockingIndex index;

    @BeforeEach
    void setUp() {
        index = new BlockingIndex(Side.RIGHT);
    }

    @Test
    void lookupReturnsIdsInOrder() {
        index.add(RecordId.of(10), Set.of("num:894"));
        index.add(RecordId.of(2), Set.of("num:894", "sfx:0573"));
        index.add(RecordId.of(7), Set.of("num:894"));

        assertEquals(List.of(RecordId.of(2), RecordId.of(7), RecordId.of(10)), List.copyOf(index.lookup("num:894")));
        assertEquals(Set.of(RecordId.of(2)), index.lookup("sfx:0573"));
        assertTrue(index.lookup("num:100").isEmpty());
        assertEquals(3, index.largestBlock());
    }

    @Test
    void lookupIsReadOnly() {
        index.add(RecordId.of(1), Set.of("k"));
        assertThrows(UnsupportedOperationException.class, () -> index.lookup("k").add(RecordId.of(2)));
    }

    @Test
    void addReplacesPreviousKeys() {
        index.add(RecordId.of(1), Set.of("a", "b"));
        index.add(RecordId.of(1), Set.of("c"));

        assertEquals(Set.of("c"), index.keysOf(RecordId.of(1)));
        assertTrue(index.lookup("a").isEmpty());
        assertEquals(1, index.keyCount());
    }

    @Test
    void removePurgesEveryKey() {
        index.add(RecordId.of(1), Set.of("a", "b"));
        index.add(RecordId.of(2), Set.of("b"));

        assertEquals(Set.of("a", "b"), index.remove(RecordId.of(1)));
        assertFalse(index.contains(RecordId.of(1)));
        assertEquals(Set.of(RecordId.of(2)), index.lookup("b"));
        assertEquals(1, index.keyCount());
        assertEquals(1, index.recordCount());
    }

    @Test
    void removeUnknownIsNoOp() {
        assertEquals(Set.of(), index.remove(RecordId.of(99)));
        assertEquals(0, index.recordCount());
    }

    @Test
    void recordWithoutKeysIsNotIndexed() {
        index.add(RecordId.of(1), Set.of());
        assertFalse(index.contains(RecordId.of(1)));
        assertEquals(0, index.largestBlock());
    }
}
