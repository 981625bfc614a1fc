package com.fuzzy.reconciliation.core.model;

import java.util.Objects;

/**
 * An immutable record on one side of the reconciliation.
 * Updates are modelled as a removal followed by an insertion with the same id.
 */
public record SourceRecord(Side side, RecordId id, FieldBag fields) {

    public SourceRecord {
        Objects.requireNonNull(side, "side is required");
        Objects.requireNonNull(id, "id is required");
        fields = fields != null ? fields : FieldBag.empty();
    }

    /**
     * Returns the key identifying this record's slot in the engine state.
     */
    public RecordKey key() {
        return new RecordKey(side, id);
    }
}
