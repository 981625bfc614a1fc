package com.fuzzy.reconciliation.output;

/**
 * Operation carried by an {@link OutputEvent}.
 */
public enum OutputOp {
    /** Insert or replace the tuple for the left id. */
    UPSERT,
    /** Withdraw a previously emitted tuple. */
    RETRACT
}
