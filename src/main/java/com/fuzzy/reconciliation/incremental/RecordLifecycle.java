package com.fuzzy.reconciliation.incremental;

/**
 * Lifecycle of a record id on one side: {@code UNSEEN -> ACTIVE -> REMOVED}.
 * A removed id that is inserted again starts a new ACTIVE incarnation.
 */
public enum RecordLifecycle {
    UNSEEN,
    ACTIVE,
    REMOVED
}
