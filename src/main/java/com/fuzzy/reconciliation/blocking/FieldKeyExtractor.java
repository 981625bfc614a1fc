package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.core.model.FieldValue;
import com.fuzzy.reconciliation.core.model.Side;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base for extractors that read a single field, possibly named differently on each side.
 * Missing and malformed values produce no keys.
 */
public abstract class FieldKeyExtractor implements BlockingKeyExtractor {

    private final String name;
    private final String leftField;
    private final String rightField;

    protected FieldKeyExtractor(String name, String leftField, String rightField) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.leftField = Objects.requireNonNull(leftField, "leftField is required");
        this.rightField = Objects.requireNonNull(rightField, "rightField is required");
    }

    @Override
    public Set<String> indexKeys(Side side, FieldBag fields) {
        return valueOf(side, fields).map(v -> prefixed(bucketsFor(v, false))).orElseGet(Set::of);
    }

    @Override
    public Set<String> probeKeys(Side side, FieldBag fields) {
        return valueOf(side, fields).map(v -> prefixed(bucketsFor(v, true))).orElseGet(Set::of);
    }

    @Override
    public String getName() {
        return name;
    }

    public String getLeftField() {
        return leftField;
    }

    public String getRightField() {
        return rightField;
    }

    /**
     * Bucket values for a field value. When {@code probing} is set, approximate extractors
     * also return the neighbouring buckets.
     */
    protected abstract Set<String> bucketsFor(FieldValue value, boolean probing);

    private Optional<FieldValue> valueOf(Side side, FieldBag fields) {
        return fields.get(side == Side.LEFT ? leftField : rightField)
                .filter(v -> !v.isMalformed());
    }

    private Set<String> prefixed(Set<String> buckets) {
        Set<String> keys = new LinkedHashSet<>();
        for (String bucket : buckets) {
            keys.add(name + ":" + bucket);
        }
        return keys;
    }
}
