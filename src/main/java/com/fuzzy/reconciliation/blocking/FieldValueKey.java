package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldValue;

import java.util.Set;

/**
 * Exact canonical value as key, e.g. {@code recipient:m. perez}.
 */
public class FieldValueKey extends FieldKeyExtractor {

    public FieldValueKey(String field) {
        this(field, field, field);
    }

    public FieldValueKey(String name, String leftField, String rightField) {
        super(name, leftField, rightField);
    }

    @Override
    protected Set<String> bucketsFor(FieldValue value, boolean probing) {
        String text = value.asText();
        return text.isEmpty() ? Set.of() : Set.of(text);
    }
}
