package com.measurestore.period;

/**
 * A point or interval in time. Exactly one variant exists per value, so a period that
 * carries both a year and a date cannot be constructed.
 */
public sealed interface PeriodValue permits DatePeriod, YearPeriod, TimeIndexPeriod {

    PeriodKind kind();

    /**
     * Human-readable value: ISO date, year digits, or the time index as decimal text.
     */
    String displayValue();
}
