package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.RecordId;

import java.util.Objects;

/**
 * An accepted left/right pair with its confidence.
 */
public record Match(RecordId leftId, RecordId rightId, double confidence) {

    public Match {
        Objects.requireNonNull(leftId, "leftId is required");
        Objects.requireNonNull(rightId, "rightId is required");
        if (!(confidence > 0.0) || confidence > 1.0) {
            throw new IllegalArgumentException("Match confidence must be in (0.0, 1.0], got " + confidence);
        }
    }

    public static Match of(CandidatePair pair) {
        return new Match(pair.leftId(), pair.rightId(), pair.score());
    }
}
