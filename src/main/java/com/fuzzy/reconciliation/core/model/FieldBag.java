package com.fuzzy.reconciliation.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable mapping from field name to normalized value.
 * Iteration order is by field name so that bags with equal content behave identically.
 */
public final class FieldBag {

    private static final FieldBag EMPTY = new FieldBag(new TreeMap<>());

    private final Map<String, FieldValue> fields;

    private FieldBag(TreeMap<String, FieldValue> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static FieldBag empty() {
        return EMPTY;
    }

    public static FieldBag of(Map<String, FieldValue> fields) {
        return new FieldBag(new TreeMap<>(fields));
    }

    public Optional<FieldValue> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Set<String> names() {
        return fields.keySet();
    }

    public Map<String, FieldValue> asMap() {
        return fields;
    }

    public boolean hasMalformed() {
        return fields.values().stream().anyMatch(FieldValue::isMalformed);
    }

    public int size() {
        return fields.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldBag other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FieldBag" + fields;
    }

    public static class Builder {
        private final TreeMap<String, FieldValue> fields = new TreeMap<>();

        public Builder put(String name, FieldValue value) {
            fields.put(name, value);
            return this;
        }

        public Builder text(String name, String canonicalText) {
            return put(name, FieldValue.text(canonicalText));
        }

        public Builder putIfAbsent(String name, FieldValue value) {
            fields.putIfAbsent(name, value);
            return this;
        }

        public boolean has(String name) {
            return fields.containsKey(name);
        }

        public FieldBag build() {
            return fields.isEmpty() ? EMPTY : new FieldBag(new TreeMap<>(fields));
        }
    }
}
