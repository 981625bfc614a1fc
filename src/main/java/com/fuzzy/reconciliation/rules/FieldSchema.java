package com.fuzzy.reconciliation.rules;

import com.fuzzy.reconciliation.core.model.FieldKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field declarations and extraction rules for one side of the reconciliation.
 * Fields that are not declared are kept as {@link FieldKind#TEXT}.
 */
public class FieldSchema {

    private final Map<String, FieldSpec> fields;
    private final List<ExtractionRule> extractionRules;

    private FieldSchema(Builder builder) {
        this.fields = new LinkedHashMap<>(builder.fields);
        List<ExtractionRule> rules = new ArrayList<>(builder.extractionRules);
        rules.sort(Comparator.comparingInt(ExtractionRule::getPriority));
        this.extractionRules = List.copyOf(rules);
    }

    /**
     * Schema with no declarations: every raw field is treated as text.
     */
    public static FieldSchema untyped() {
        return builder().build();
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Collection<FieldSpec> fields() {
        return fields.values();
    }

    public FieldKind kindOf(String name) {
        FieldSpec spec = fields.get(name);
        return spec != null ? spec.kind() : FieldKind.TEXT;
    }

    public List<ExtractionRule> extractionRules() {
        return extractionRules;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private final List<ExtractionRule> extractionRules = new ArrayList<>();

        public Builder field(String name, FieldKind kind) {
            return field(FieldSpec.optional(name, kind));
        }

        public Builder requiredField(String name, FieldKind kind) {
            return field(FieldSpec.required(name, kind));
        }

        public Builder field(FieldSpec spec) {
            fields.put(spec.name(), spec);
            return this;
        }

        public Builder extract(ExtractionRule rule) {
            extractionRules.add(rule);
            return this;
        }

        public FieldSchema build() {
            return new FieldSchema(this);
        }
    }
}
