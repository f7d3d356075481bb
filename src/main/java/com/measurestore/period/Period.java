package com.measurestore.period;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stored period row. Immutable once created.
 */
public record Period(
    @JsonProperty("id") long id,
    @JsonIgnore PeriodValue value
) {

    @JsonProperty("kind")
    public PeriodKind kind() {
        return value.kind();
    }

    @JsonProperty("value")
    public String displayValue() {
        return value.displayValue();
    }

    @JsonIgnore
    public boolean isYear() {
        return value instanceof YearPeriod;
    }
}
