package com.measurestore.fact;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Caller-selectable ordering for measurement queries. Ties fall back to id ascending.
 */
public enum MeasurementOrder {
    ID_ASC("id_asc", Comparator.comparingLong(Measurement::id)),
    ID_DESC("id_desc", Comparator.comparingLong(Measurement::id).reversed()),
    CREATED_AT_ASC("created_at_asc", Comparator.comparing(Measurement::createdAt)),
    CREATED_AT_DESC("created_at_desc", Comparator.comparing(Measurement::createdAt).reversed()),
    VALUE_ASC("value_asc", Comparator.comparingDouble(Measurement::value)),
    VALUE_DESC("value_desc", Comparator.comparingDouble(Measurement::value).reversed());

    private final String value;
    private final Comparator<Measurement> comparator;

    MeasurementOrder(String value, Comparator<Measurement> comparator) {
        this.value = value;
        this.comparator = comparator.thenComparingLong(Measurement::id);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Comparator<Measurement> comparator() {
        return comparator;
    }

    public static MeasurementOrder fromValue(String raw) {
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown measurement order: " + raw));
    }
}
