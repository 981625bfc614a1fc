package com.fuzzy.reconciliation.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A raw input change delivered by an ingestion collaborator.
 * Field values are unparsed strings; they are normalized once at the engine boundary.
 */
public record DeltaEvent(Side side, DeltaOp op, String id, Map<String, String> fields) {

    public DeltaEvent {
        Objects.requireNonNull(side, "side is required");
        Objects.requireNonNull(op, "op is required");
        Objects.requireNonNull(id, "id is required");
        Map<String, String> copy = new TreeMap<>();
        if (fields != null) {
            fields.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name, value);
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public static DeltaEvent insert(Side side, String id, Map<String, String> fields) {
        return new DeltaEvent(side, DeltaOp.INSERT, id, fields);
    }

    public static DeltaEvent remove(Side side, String id) {
        return new DeltaEvent(side, DeltaOp.REMOVE, id, Map.of());
    }

    public RecordKey key() {
        return new RecordKey(side, RecordId.of(id));
    }
}
