package com.measurestore.period;

import com.fasterxml.jackson.annotation.JsonValue;
import com.measurestore.contract.InvalidPeriodException;

import java.util.Arrays;

public enum PeriodKind {
    DATE("date"),
    YEAR("year"),
    TIME("time");

    private final String value;

    PeriodKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PeriodKind fromValue(String raw) {
        if (raw == null) {
            throw new InvalidPeriodException("period kind is required");
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new InvalidPeriodException("unknown period kind: " + raw));
    }
}
