package com.fuzzy.reconciliation.rules;

import com.fuzzy.reconciliation.core.model.FieldKind;

import java.util.Objects;

/**
 * Declared field of a side's schema.
 */
public record FieldSpec(String name, FieldKind kind, boolean required) {

    public FieldSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        if (kind == FieldKind.MALFORMED) {
            throw new IllegalArgumentException("MALFORMED is not a declarable field kind");
        }
    }

    public static FieldSpec optional(String name, FieldKind kind) {
        return new FieldSpec(name, kind, false);
    }

    public static FieldSpec required(String name, FieldKind kind) {
        return new FieldSpec(name, kind, true);
    }
}
