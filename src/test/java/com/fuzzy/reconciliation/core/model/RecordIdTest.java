package com.fuzzy.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordIdTest {

    @ParameterizedTest
    @CsvSource({
            "2, 10",
            "9, 10",
            "0, 1",
            "99, 100",
            "10, abc",
            "a, b",
            "abc, abd"
    })
    @DisplayName("Smaller id sorts first")
    void ordering(String smaller, String larger) {
        assertTrue(RecordId.of(smaller).compareTo(RecordId.of(larger)) < 0);
        assertTrue(RecordId.of(larger).compareTo(RecordId.of(smaller)) > 0);
    }

    @Test
    @DisplayName("Numeric ids sort numerically, then text ids lexicographically")
    void mixedSort() {
        List<RecordId> ids = new ArrayList<>(List.of(
                RecordId.of("b"), RecordId.of("10"), RecordId.of("2"), RecordId.of("a"), RecordId.of("1")));
        Collections.sort(ids);
        assertEquals(List.of(RecordId.of("1"), RecordId.of("2"), RecordId.of("10"),
                RecordId.of("a"), RecordId.of("b")), ids);
    }

    @Test
    @DisplayName("Padded numeric ids stay distinct and consistently ordered")
    void leadingZeros() {
        RecordId padded = RecordId.of("007");
        RecordId plain = RecordId.of("7");
        assertNotEquals(padded, plain);
        assertNotEquals(0, padded.compareTo(plain));
        assertEquals(-Integer.signum(padded.compareTo(plain)), Integer.signum(plain.compareTo(padded)));
        assertTrue(padded.compareTo(RecordId.of("8")) < 0);
    }

    @Test
    void equalIdsCompareAsZero() {
        assertEquals(0, RecordId.of("42").compareTo(RecordId.of(42)));
        assertEquals(RecordId.of("42"), RecordId.of(42));
    }

    @Test
    void blankIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> RecordId.of(" "));
        assertThrows(NullPointerException.class, () -> RecordId.of(null));
    }

    @Test
    void recordKeyOrdersLeftBeforeRight() {
        RecordKey left = RecordKey.left(RecordId.of(99));
        RecordKey right = RecordKey.right(RecordId.of(1));
        assertTrue(left.compareTo(right) < 0);
        assertEquals("L:99", left.toString());
        assertEquals("R:1", right.toString());
    }
}
