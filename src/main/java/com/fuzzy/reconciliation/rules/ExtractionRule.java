package com.fuzzy.reconciliation.rules;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a typed field out of a free-text source field with a regular expression.
 * Rules run in priority order (lower number first); the first rule that yields a value
 * for a target field wins.
 *
 * <p>Example: extract the amount from
 * {@code "EUR 8944 on 2020-06-06 ... amount EUR 8946."}</p>
 * <pre>
 * ExtractionRule.builder()
 *         .name("amount-after-keyword")
 *         .sourceField("description")
 *         .pattern("amount\\s+(?:eur|usd|€)?\\s*([0-9][0-9_.,]*)")
 *         .targetField("amount")
 *         .build();
 * </pre>
 */
public class ExtractionRule {
    private final String name;
    private final String sourceField;
    private final Pattern pattern;
    private final int group;
    private final String targetField;
    private final int priority;

    private ExtractionRule(Builder builder) {
        this.name = builder.name;
        this.sourceField = builder.sourceField;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.group = builder.group;
        this.targetField = builder.targetField;
        this.priority = builder.priority;
        if (group > pattern.matcher("").groupCount()) {
            throw new IllegalArgumentException("Rule '" + name + "' references group " + group
                    + " but pattern has " + pattern.matcher("").groupCount());
        }
    }

    public String getName() {
        return name;
    }

    public String getSourceField() {
        return sourceField;
    }

    public String getTargetField() {
        return targetField;
    }

    public int getPriority() {
        return priority;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Applies the rule to the raw source text.
     *
     * @return the captured text, trimmed, or empty when the pattern does not match
     */
    public Optional<String> extract(String sourceText) {
        if (sourceText == null || sourceText.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(sourceText);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String captured = matcher.group(group);
        if (captured == null || captured.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(captured.trim());
    }

    @Override
    public String toString() {
        return "ExtractionRule{" +
                "name='" + name + '\'' +
                ", " + sourceField + " -> " + targetField +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String sourceField;
        private String pattern;
        private int group = 1;
        private String targetField;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder sourceField(String sourceField) {
            this.sourceField = sourceField;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder group(int group) {
            if (group < 0) {
                throw new IllegalArgumentException("group must be >= 0");
            }
            this.group = group;
            return this;
        }

        public Builder targetField(String targetField) {
            this.targetField = targetField;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public ExtractionRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(sourceField, "sourceField is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(targetField, "targetField is required");
            return new ExtractionRule(this);
        }
    }
}
