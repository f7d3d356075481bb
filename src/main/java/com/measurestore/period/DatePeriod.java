package com.measurestore.period;

import java.time.LocalDate;
import java.util.Objects;

public record DatePeriod(LocalDate date) implements PeriodValue {

    public DatePeriod {
        Objects.requireNonNull(date, "date");
    }

    @Override
    public PeriodKind kind() {
        return PeriodKind.DATE;
    }

    @Override
    public String displayValue() {
        return date.toString();
    }
}
