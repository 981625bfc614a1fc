package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.core.model.FieldValue;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Numeric comparison with linear decay: {@code max(0, 1 - |a - b| / tolerance)}.
 * A tolerance of zero degenerates to exact numeric equality.
 */
public class NumericToleranceComparator implements FieldComparator {

    private final BigDecimal tolerance;

    public NumericToleranceComparator(double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        this.tolerance = BigDecimal.valueOf(tolerance);
    }

    @Override
    public double compare(FieldValue left, FieldValue right) {
        BigDecimal a = requireNumber(left);
        BigDecimal b = requireNumber(right);
        BigDecimal difference = a.subtract(b).abs();
        if (difference.signum() == 0) {
            return 1.0;
        }
        if (tolerance.signum() == 0 || difference.compareTo(tolerance) >= 0) {
            return 0.0;
        }
        return 1.0 - difference.divide(tolerance, MathContext.DECIMAL64).doubleValue();
    }

    @Override
    public String getName() {
        return "numeric";
    }

    public double getTolerance() {
        return tolerance.doubleValue();
    }

    private static BigDecimal requireNumber(FieldValue value) {
        if (value.kind() != FieldKind.NUMBER) {
            throw new MalformedRecordException(null, "Expected a number but got " + value);
        }
        return value.number();
    }
}
