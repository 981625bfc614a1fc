package com.fuzzy.reconciliation.rules;

import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.core.model.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsers that reduce raw strings to canonical {@link FieldValue}s.
 */
public final class ValueParsers {
    private static final Logger log = LoggerFactory.getLogger(ValueParsers.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.,\\-]");
    private static final Pattern THOUSANDS_COMMAS = Pattern.compile("-?\\d{1,3}(,\\d{3})+(\\.\\d+)?");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy"));

    private ValueParsers() {
    }

    /**
     * Parses a raw string into a value of the requested kind.
     * Unparseable input yields a {@link FieldKind#MALFORMED} value carrying the raw text.
     */
    public static FieldValue parse(String raw, FieldKind kind) {
        if (raw == null) {
            return FieldValue.malformed("");
        }
        return switch (kind) {
            case TEXT -> FieldValue.text(canonicalText(raw));
            case NUMBER -> parseNumber(raw).map(FieldValue::number).orElseGet(() -> FieldValue.malformed(raw));
            case DATE -> parseDate(raw).map(FieldValue::date).orElseGet(() -> FieldValue.malformed(raw));
            case MALFORMED -> FieldValue.malformed(raw);
        };
    }

    /**
     * Lower-cases, trims and collapses whitespace.
     */
    public static String canonicalText(String raw) {
        return WHITESPACE.matcher(raw.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    /**
     * Parses amounts such as {@code 8946}, {@code 8_946}, {@code 8,946.00}, {@code EUR 8946}
     * or {@code 8946 €}. A lone comma followed by one or two digits is read as a decimal separator.
     */
    public static Optional<BigDecimal> parseNumber(String raw) {
        String cleaned = NON_NUMERIC.matcher(raw.replace("_", "")).replaceAll("");
        if (cleaned.isEmpty() || cleaned.chars().noneMatch(Character::isDigit)) {
            return Optional.empty();
        }
        if (cleaned.contains(",")) {
            if (cleaned.contains(".") || THOUSANDS_COMMAS.matcher(cleaned).matches()) {
                cleaned = cleaned.replace(",", "");
            } else {
                cleaned = cleaned.replace(',', '.');
            }
        }
        // trailing sentence punctuation, e.g. "amount EUR 8946."
        while (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<LocalDate> parseDate(String raw) {
        String trimmed = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(trimmed, format));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match date format {}", trimmed, format);
            }
        }
        return Optional.empty();
    }
}
