package com.fuzzy.reconciliation.similarity;

import java.util.Objects;

/**
 * Scoring rule for one logical field.
 *
 * @param leftField    field name on the left record
 * @param rightField   field name on the right record (often identical to {@code leftField})
 * @param comparator   comparator producing the field score
 * @param weight       relative weight in {@link AggregationMode#WEIGHTED_AVERAGE}
 * @param required     whether the field participates in {@link AggregationMode#MIN_OVER_REQUIRED}
 * @param missingScore score used when either record lacks the field
 */
public record FieldRule(
        String leftField,
        String rightField,
        FieldComparator comparator,
        double weight,
        boolean required,
        double missingScore
) {
    public FieldRule {
        Objects.requireNonNull(leftField, "leftField is required");
        Objects.requireNonNull(rightField, "rightField is required");
        Objects.requireNonNull(comparator, "comparator is required");
        if (!(weight > 0)) {
            throw new IllegalArgumentException("weight must be positive for field " + leftField);
        }
        if (missingScore < 0.0 || missingScore > 1.0) {
            throw new IllegalArgumentException("missingScore must be between 0.0 and 1.0");
        }
    }

    public static FieldRule of(String field, FieldComparator comparator, double weight) {
        return new FieldRule(field, field, comparator, weight, false, 0.0);
    }

    public static FieldRule required(String field, FieldComparator comparator, double weight) {
        return new FieldRule(field, field, comparator, weight, true, 0.0);
    }

    public FieldRule withMissingScore(double score) {
        return new FieldRule(leftField, rightField, comparator, weight, required, score);
    }

    public FieldRule withRightField(String field) {
        return new FieldRule(leftField, field, comparator, weight, required, missingScore);
    }
}
