package com.fuzzy.reconciliation.incremental;

import com.fuzzy.reconciliation.core.model.RecordId;

import java.util.Objects;
import java.util.Optional;

/**
 * One change to the assignment, as seen from a left record's slot.
 *
 * @param type               kind of change
 * @param leftId             affected left record
 * @param rightId            partner involved, null for {@code LEFT_ADDED} and {@code LEFT_REMOVED}
 * @param confidence         confidence after the change (0 when unmatched)
 * @param previousConfidence confidence before the change (0 when previously unmatched)
 */
public record AssignmentChange(
        Type type,
        RecordId leftId,
        RecordId rightId,
        double confidence,
        double previousConfidence
) {
    public enum Type {
        /** A left record became active; its slot starts unmatched. */
        LEFT_ADDED,
        /** A left record was removed; its slot disappears. */
        LEFT_REMOVED,
        PAIR_ADDED,
        PAIR_REMOVED,
        CONFIDENCE_CHANGED
    }

    public AssignmentChange {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(leftId, "leftId is required");
    }

    public static AssignmentChange leftAdded(RecordId leftId) {
        return new AssignmentChange(Type.LEFT_ADDED, leftId, null, 0.0, 0.0);
    }

    public static AssignmentChange leftRemoved(RecordId leftId) {
        return new AssignmentChange(Type.LEFT_REMOVED, leftId, null, 0.0, 0.0);
    }

    public static AssignmentChange pairAdded(RecordId leftId, RecordId rightId, double confidence) {
        return new AssignmentChange(Type.PAIR_ADDED, leftId, rightId, confidence, 0.0);
    }

    public static AssignmentChange pairRemoved(RecordId leftId, RecordId rightId, double previousConfidence) {
        return new AssignmentChange(Type.PAIR_REMOVED, leftId, rightId, 0.0, previousConfidence);
    }

    public static AssignmentChange confidenceChanged(RecordId leftId, RecordId rightId,
                                                     double previous, double current) {
        return new AssignmentChange(Type.CONFIDENCE_CHANGED, leftId, rightId, current, previous);
    }

    public Optional<RecordId> right() {
        return Optional.ofNullable(rightId);
    }
}
