package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.core.model.FieldValue;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Date comparison with linear decay over a window of days.
 * Same day scores 1.0; {@code toleranceDays} apart or more scores 0.0.
 */
public class DateToleranceComparator implements FieldComparator {

    private final int toleranceDays;

    public DateToleranceComparator(int toleranceDays) {
        if (toleranceDays < 0) {
            throw new IllegalArgumentException("toleranceDays must be >= 0");
        }
        this.toleranceDays = toleranceDays;
    }

    @Override
    public double compare(FieldValue left, FieldValue right) {
        long days = Math.abs(ChronoUnit.DAYS.between(requireDate(left), requireDate(right)));
        if (days == 0) {
            return 1.0;
        }
        if (days >= toleranceDays) {
            return 0.0;
        }
        return 1.0 - (double) days / toleranceDays;
    }

    @Override
    public String getName() {
        return "date";
    }

    public int getToleranceDays() {
        return toleranceDays;
    }

    private static LocalDate requireDate(FieldValue value) {
        if (value.kind() != FieldKind.DATE) {
            throw new MalformedRecordException(null, "Expected a date but got " + value);
        }
        return value.date();
    }
}
