package com.fuzzy.reconciliation.core.model;

import java.util.Objects;

/**
 * Opaque, stable record identifier supplied by ingestion.
 *
 * <p>Identifiers are totally ordered so that every tie-break in candidate ranking and
 * assignment is reproducible. Integral identifiers compare numerically ({@code 2 < 10});
 * they sort before non-numeric identifiers, which compare lexicographically.</p>
 */
public record RecordId(String value) implements Comparable<RecordId> {

    public RecordId {
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Record id must not be blank");
        }
    }

    public static RecordId of(String value) {
        return new RecordId(value);
    }

    public static RecordId of(long value) {
        return new RecordId(Long.toString(value));
    }

    @Override
    public int compareTo(RecordId other) {
        boolean thisNumeric = isIntegral(value);
        boolean otherNumeric = isIntegral(other.value);
        if (thisNumeric && otherNumeric) {
            int byLength = Integer.compare(stripLeadingZeros(value).length(),
                    stripLeadingZeros(other.value).length());
            if (byLength != 0) {
                return byLength;
            }
            int byDigits = stripLeadingZeros(value).compareTo(stripLeadingZeros(other.value));
            return byDigits != 0 ? byDigits : value.compareTo(other.value);
        }
        if (thisNumeric != otherNumeric) {
            return thisNumeric ? -1 : 1;
        }
        return value.compareTo(other.value);
    }

    private static boolean isIntegral(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    @Override
    public String toString() {
        return value;
    }
}
