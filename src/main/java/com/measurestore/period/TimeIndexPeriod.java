package com.measurestore.period;

import com.measurestore.contract.InvalidPeriodException;

import java.math.BigDecimal;

/**
 * Numeric model time (e.g. a simulation step). Negative zero is folded into zero so both
 * resolve to the same period.
 */
public record TimeIndexPeriod(double time) implements PeriodValue {

    public TimeIndexPeriod {
        if (!Double.isFinite(time)) {
            throw new InvalidPeriodException("time value must be finite, got " + time);
        }
        if (time == 0.0) {
            time = 0.0;
        }
    }

    @Override
    public PeriodKind kind() {
        return PeriodKind.TIME;
    }

    /**
     * Plain decimal text, never scientific notation; whole numbers keep a trailing {@code .0}.
     */
    @Override
    public String displayValue() {
        BigDecimal plain = BigDecimal.valueOf(time).stripTrailingZeros();
        String text = plain.toPlainString();
        return plain.scale() <= 0 ? text + ".0" : text;
    }
}
