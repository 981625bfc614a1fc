package com.fuzzy.reconciliation.similarity;

import java.util.Locale;

/**
 * Creates comparators from their configuration names.
 */
public final class Comparators {

    private Comparators() {
    }

    /**
     * @param name      one of {@code exact}, {@code numeric}, {@code date}, {@code edit-distance},
     *                  {@code jaro-winkler}, {@code token-set}, {@code digit-suffix}
     * @param parameter tolerance, window in days, or suffix length; ignored by the string comparators
     */
    public static FieldComparator byName(String name, double parameter) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "exact" -> new ExactComparator();
            case "numeric" -> new NumericToleranceComparator(parameter);
            case "date" -> new DateToleranceComparator((int) parameter);
            case "edit-distance", "levenshtein" -> new EditDistanceComparator();
            case "jaro-winkler" -> new JaroWinklerComparator();
            case "token-set", "jaccard" -> new TokenSetComparator();
            case "digit-suffix" -> new DigitSuffixComparator((int) parameter);
            default -> throw new IllegalArgumentException("Unknown comparator: " + name);
        };
    }
}
