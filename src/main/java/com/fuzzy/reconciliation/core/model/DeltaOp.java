package com.fuzzy.reconciliation.core.model;

/**
 * Operation carried by an input delta.
 */
public enum DeltaOp {
    INSERT,
    REMOVE
}
