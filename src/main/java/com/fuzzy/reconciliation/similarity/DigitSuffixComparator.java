package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldValue;

/**
 * Compares the trailing digits of identifiers written with different padding or prefixes,
 * e.g. {@code HU30186000000000000008280573} against {@code 00000000008280573}.
 * Score is the length of the agreeing digit suffix divided by {@code length}.
 */
public class DigitSuffixComparator implements FieldComparator {

    private final int length;

    public DigitSuffixComparator(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        this.length = length;
    }

    @Override
    public double compare(FieldValue left, FieldValue right) {
        String a = digits(left.asText());
        String b = digits(right.asText());
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int agreeing = 0;
        while (agreeing < length
                && agreeing < a.length()
                && agreeing < b.length()
                && a.charAt(a.length() - 1 - agreeing) == b.charAt(b.length() - 1 - agreeing)) {
            agreeing++;
        }
        return (double) agreeing / length;
    }

    @Override
    public String getName() {
        return "digit-suffix";
    }

    public int getLength() {
        return length;
    }

    static String digits(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
