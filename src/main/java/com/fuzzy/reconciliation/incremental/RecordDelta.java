package com.fuzzy.reconciliation.incremental;

import com.fuzzy.reconciliation.core.model.DeltaOp;
import com.fuzzy.reconciliation.core.model.RecordKey;
import com.fuzzy.reconciliation.core.model.SourceRecord;

import java.util.Objects;

/**
 * A normalized input change: an insertion carries the typed record, a removal only its key.
 */
public record RecordDelta(DeltaOp op, RecordKey key, SourceRecord record) {

    public RecordDelta {
        Objects.requireNonNull(op, "op is required");
        Objects.requireNonNull(key, "key is required");
        if (op == DeltaOp.INSERT && record == null) {
            throw new IllegalArgumentException("Insert of " + key + " needs a record");
        }
    }

    public static RecordDelta insert(SourceRecord record) {
        return new RecordDelta(DeltaOp.INSERT, record.key(), record);
    }

    public static RecordDelta remove(RecordKey key) {
        return new RecordDelta(DeltaOp.REMOVE, key, null);
    }
}
