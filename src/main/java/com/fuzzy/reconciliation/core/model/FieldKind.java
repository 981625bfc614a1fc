package com.fuzzy.reconciliation.core.model;

/**
 * The closed set of normalized value kinds a record field can hold.
 */
public enum FieldKind {
    /** Lower-cased text with collapsed whitespace. */
    TEXT,
    /** Decimal number. */
    NUMBER,
    /** Calendar date. */
    DATE,
    /** Raw input that did not parse for its declared kind. */
    MALFORMED
}
