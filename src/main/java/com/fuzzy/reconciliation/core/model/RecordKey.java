package com.fuzzy.reconciliation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Side-qualified record identifier. Ids are only unique within a side.
 * Ordered LEFT before RIGHT, then by id.
 */
public record RecordKey(Side side, RecordId id) implements Comparable<RecordKey> {

    private static final Comparator<RecordKey> ORDER = Comparator
            .comparing(RecordKey::side)
            .thenComparing(RecordKey::id);

    public RecordKey {
        Objects.requireNonNull(side, "side is required");
        Objects.requireNonNull(id, "id is required");
    }

    public static RecordKey left(RecordId id) {
        return new RecordKey(Side.LEFT, id);
    }

    public static RecordKey right(RecordId id) {
        return new RecordKey(Side.RIGHT, id);
    }

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return (side == Side.LEFT ? "L:" : "R:") + id;
    }
}
