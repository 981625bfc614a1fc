package com.fuzzy.reconciliation.api;

import com.fuzzy.reconciliation.incremental.AssignmentDiff;
import com.fuzzy.reconciliation.output.OutputEvent;

import java.util.List;
import java.util.Objects;

/**
 * Result of one committed batch.
 *
 * @param batchId    sequential batch id
 * @param diff       assignment changes produced by the batch
 * @param events     output events published to the sinks
 * @param sinkErrors messages of sinks that failed while receiving the events; the batch stays committed
 */
public record BatchOutcome(String batchId, AssignmentDiff diff, List<OutputEvent> events, List<String> sinkErrors) {

    public BatchOutcome {
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(diff, "diff is required");
        events = events != null ? List.copyOf(events) : List.of();
        sinkErrors = sinkErrors != null ? List.copyOf(sinkErrors) : List.of();
    }

    public boolean hasSinkErrors() {
        return !sinkErrors.isEmpty();
    }
}
