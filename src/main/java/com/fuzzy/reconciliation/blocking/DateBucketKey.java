package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.core.model.FieldValue;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Buckets dates into windows of {@code days} days counted from the epoch.
 * Probes cover the neighbouring windows.
 */
public class DateBucketKey extends FieldKeyExtractor {

    private final int days;

    public DateBucketKey(String field, int days) {
        this("date", field, field, days);
    }

    public DateBucketKey(String name, String leftField, String rightField, int days) {
        super(name, leftField, rightField);
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        this.days = days;
    }

    @Override
    protected Set<String> bucketsFor(FieldValue value, boolean probing) {
        if (value.kind() != FieldKind.DATE) {
            return Set.of();
        }
        long window = Math.floorDiv(value.date().toEpochDay(), days);
        if (!probing) {
            return Set.of(Long.toString(window));
        }
        Set<String> windows = new LinkedHashSet<>();
        windows.add(Long.toString(window - 1));
        windows.add(Long.toString(window));
        windows.add(Long.toString(window + 1));
        return windows;
    }
}
