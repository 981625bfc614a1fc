package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldValue;

import java.util.Set;

/**
 * Last {@code length} digits of an identifier, e.g. the account-number suffix shared by
 * {@code HU30186000000000000008280573} and {@code 00000000008280573}.
 * Values with fewer digits than {@code length} produce no key.
 */
public class SuffixKey extends FieldKeyExtractor {

    private final int length;

    public SuffixKey(String field, int length) {
        this("sfx", field, field, length);
    }

    public SuffixKey(String name, String leftField, String rightField, int length) {
        super(name, leftField, rightField);
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        this.length = length;
    }

    @Override
    protected Set<String> bucketsFor(FieldValue value, boolean probing) {
        String text = value.asText();
        StringBuilder digits = new StringBuilder(length);
        for (int i = text.length() - 1; i >= 0 && digits.length() < length; i--) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        if (digits.length() < length) {
            return Set.of();
        }
        return Set.of(digits.reverse().toString());
    }
}
