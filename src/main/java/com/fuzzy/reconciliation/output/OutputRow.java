package com.fuzzy.reconciliation.output;

import com.fuzzy.reconciliation.core.model.RecordId;

import java.util.Objects;
import java.util.Optional;

/**
 * One row of the left-join view: every active left record appears exactly once,
 * with no partner and confidence 0 when it is unmatched.
 */
public record OutputRow(RecordId leftId, RecordId rightId, double confidence) {

    public OutputRow {
        Objects.requireNonNull(leftId, "leftId is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (rightId == null && confidence != 0.0) {
            throw new IllegalArgumentException("unmatched row for " + leftId + " must have confidence 0");
        }
        if (rightId != null && confidence == 0.0) {
            throw new IllegalArgumentException("matched row for " + leftId + " must have positive confidence");
        }
    }

    public static OutputRow unmatched(RecordId leftId) {
        return new OutputRow(leftId, null, 0.0);
    }

    public static OutputRow matched(RecordId leftId, RecordId rightId, double confidence) {
        return new OutputRow(leftId, Objects.requireNonNull(rightId, "rightId is required"), confidence);
    }

    public boolean isMatched() {
        return rightId != null;
    }

    public Optional<RecordId> right() {
        return Optional.ofNullable(rightId);
    }
}
