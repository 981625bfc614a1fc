package com.fuzzy.reconciliation.assignment;

/**
 * An engine invariant was found violated, e.g. a right record matched to two left records.
 * Never repaired in place: the batch that observed it is rejected and rolled back.
 */
public class StateCorruptionException extends RuntimeException {

    public StateCorruptionException(String message) {
        super(message);
    }
}
