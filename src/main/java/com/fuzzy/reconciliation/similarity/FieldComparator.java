package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldValue;

/**
 * Compares two normalized values of the same logical field.
 * Implementations must be pure, return a score between 0.0 and 1.0, and never
 * score closer values lower than more distant ones.
 */
public interface FieldComparator {

    /**
     * @param left  value from the left record, never malformed
     * @param right value from the right record, never malformed
     * @return similarity between 0.0 and 1.0
     * @throws MalformedRecordException if the values are of a kind this comparator cannot score
     */
    double compare(FieldValue left, FieldValue right);

    /**
     * Returns the name used in configuration and logs.
     */
    String getName();
}
