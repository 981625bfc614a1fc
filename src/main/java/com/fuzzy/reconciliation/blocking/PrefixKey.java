package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldValue;

import java.util.Set;

/**
 * First {@code length} characters of the canonical text; shorter values are used whole.
 */
public class PrefixKey extends FieldKeyExtractor {

    private final int length;

    public PrefixKey(String field, int length) {
        this("pfx", field, field, length);
    }

    public PrefixKey(String name, String leftField, String rightField, int length) {
        super(name, leftField, rightField);
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        this.length = length;
    }

    @Override
    protected Set<String> bucketsFor(FieldValue value, boolean probing) {
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return Set.of();
        }
        return Set.of(text.length() > length ? text.substring(0, length) : text);
    }
}
