package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.core.model.FieldValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Buckets numbers into ranges of {@code width}. Probes cover the neighbouring ranges,
 * so any two values less than {@code width} apart always share a key.
 */
public class NumericBucketKey extends FieldKeyExtractor {

    private final BigDecimal width;

    public NumericBucketKey(String field, double width) {
        this("num", field, field, width);
    }

    public NumericBucketKey(String name, String leftField, String rightField, double width) {
        super(name, leftField, rightField);
        if (!(width > 0)) {
            throw new IllegalArgumentException("width must be positive");
        }
        this.width = BigDecimal.valueOf(width);
    }

    @Override
    protected Set<String> bucketsFor(FieldValue value, boolean probing) {
        if (value.kind() != FieldKind.NUMBER) {
            return Set.of();
        }
        BigDecimal bucket = value.number().divide(width, 0, RoundingMode.FLOOR);
        if (!probing) {
            return Set.of(bucket.toPlainString());
        }
        Set<String> buckets = new LinkedHashSet<>();
        buckets.add(bucket.subtract(BigDecimal.ONE).toPlainString());
        buckets.add(bucket.toPlainString());
        buckets.add(bucket.add(BigDecimal.ONE).toPlainString());
        return buckets;
    }
}
