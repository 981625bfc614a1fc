package com.fuzzy.reconciliation.output;

import com.fuzzy.reconciliation.core.model.RecordId;

import java.util.Objects;
import java.util.Optional;

/**
 * Externally visible change to the left-join view.
 *
 * @param leftId     left record the tuple belongs to
 * @param rightId    matched right record, or null when the left record is unmatched
 * @param confidence match confidence; 0 exactly when {@code rightId} is null
 * @param op         upsert of a new tuple or retraction of a previously emitted one
 */
public record OutputEvent(RecordId leftId, RecordId rightId, double confidence, OutputOp op) {

    public OutputEvent {
        Objects.requireNonNull(leftId, "leftId is required");
        Objects.requireNonNull(op, "op is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if ((rightId == null) != (confidence == 0.0)) {
            throw new IllegalArgumentException(
                    "confidence must be 0 exactly when there is no partner: " + leftId + " -> " + rightId);
        }
    }

    public static OutputEvent upsert(OutputRow row) {
        return new OutputEvent(row.leftId(), row.rightId(), row.confidence(), OutputOp.UPSERT);
    }

    public static OutputEvent retract(OutputRow row) {
        return new OutputEvent(row.leftId(), row.rightId(), row.confidence(), OutputOp.RETRACT);
    }

    public Optional<RecordId> right() {
        return Optional.ofNullable(rightId);
    }

    public OutputRow toRow() {
        return new OutputRow(leftId, rightId, confidence);
    }

    @Override
    public String toString() {
        return op + "(" + leftId + ", " + (rightId != null ? rightId : "none") + ", " + confidence + ")";
    }
}
