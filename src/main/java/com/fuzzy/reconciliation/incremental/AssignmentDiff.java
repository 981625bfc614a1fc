package com.fuzzy.reconciliation.incremental;

import java.util.List;

/**
 * Ordered changes produced by one batch. Changes are grouped by left id in ascending order;
 * within a left id a removal always precedes an addition.
 */
public record AssignmentDiff(String batchId, List<AssignmentChange> changes) {

    public AssignmentDiff {
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public static AssignmentDiff empty(String batchId) {
        return new AssignmentDiff(batchId, List.of());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public long count(AssignmentChange.Type type) {
        return changes.stream().filter(c -> c.type() == type).count();
    }

    @Override
    public String toString() {
        return "AssignmentDiff{" +
                "batchId='" + batchId + '\'' +
                ", pairsAdded=" + count(AssignmentChange.Type.PAIR_ADDED) +
                ", pairsRemoved=" + count(AssignmentChange.Type.PAIR_REMOVED) +
                ", confidenceChanged=" + count(AssignmentChange.Type.CONFIDENCE_CHANGED) +
                ", leftAdded=" + count(AssignmentChange.Type.LEFT_ADDED) +
                ", leftRemoved=" + count(AssignmentChange.Type.LEFT_REMOVED) +
                '}';
    }
}
