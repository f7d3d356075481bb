package com.measurestore.period;

public record YearPeriod(int year) implements PeriodValue {

    @Override
    public PeriodKind kind() {
        return PeriodKind.YEAR;
    }

    @Override
    public String displayValue() {
        return Integer.toString(year);
    }
}
