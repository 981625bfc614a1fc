package com.fuzzy.reconciliation.core.model;

/**
 * The two collections being reconciled.
 * LEFT is the side every output row is keyed on; RIGHT supplies the partners.
 */
public enum Side {
    LEFT,
    RIGHT;

    /**
     * Returns the side records of this side are matched against.
     */
    public Side opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
