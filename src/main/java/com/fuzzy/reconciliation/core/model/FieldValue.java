package com.fuzzy.reconciliation.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single normalized field value. Exactly one payload is set, matching {@link #kind()}.
 * Values are produced once at the ingestion boundary and never re-parsed during scoring.
 */
public record FieldValue(
        FieldKind kind,
        String text,
        BigDecimal number,
        LocalDate date
) {
    public FieldValue {
        Objects.requireNonNull(kind, "kind is required");
        switch (kind) {
            case TEXT, MALFORMED -> Objects.requireNonNull(text, "text is required for " + kind);
            case NUMBER -> Objects.requireNonNull(number, "number is required for NUMBER");
            case DATE -> Objects.requireNonNull(date, "date is required for DATE");
        }
        if (number != null) {
            // 8946 and 8946.00 must compare equal
            number = number.stripTrailingZeros();
        }
    }

    public static FieldValue text(String canonicalText) {
        return new FieldValue(FieldKind.TEXT, canonicalText, null, null);
    }

    public static FieldValue number(BigDecimal number) {
        return new FieldValue(FieldKind.NUMBER, null, number, null);
    }

    public static FieldValue date(LocalDate date) {
        return new FieldValue(FieldKind.DATE, null, null, date);
    }

    public static FieldValue malformed(String raw) {
        return new FieldValue(FieldKind.MALFORMED, raw, null, null);
    }

    public boolean isMalformed() {
        return kind == FieldKind.MALFORMED;
    }

    /**
     * Renders the value as text regardless of kind, for string comparators and blocking keys.
     */
    public String asText() {
        return switch (kind) {
            case TEXT, MALFORMED -> text;
            case NUMBER -> number.toPlainString();
            case DATE -> date.toString();
        };
    }

    @Override
    public String toString() {
        return kind + "(" + asText() + ")";
    }
}
