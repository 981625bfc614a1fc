package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldValue;

/**
 * 1.0 when the canonical values are equal, 0.0 otherwise.
 */
public class ExactComparator implements FieldComparator {

    @Override
    public double compare(FieldValue left, FieldValue right) {
        if (left.kind() != right.kind()) {
            return left.asText().equals(right.asText()) ? 1.0 : 0.0;
        }
        return left.equals(right) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "exact";
    }
}
