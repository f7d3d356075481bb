package com.measurestore.registry;

import com.fasterxml.jackson.annotation.JsonValue;
import com.measurestore.contract.ConstraintViolationException;

import java.util.Arrays;

public enum EntityType {
    COUNTRY("country"),
    ORGANIZATION("organization"),
    PROJECT("project"),
    PERSONA("persona"),
    EXPERIMENT("experiment"),
    DATASET("dataset"),
    OTHER("other");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static EntityType fromValue(String raw) {
        if (raw == null) {
            throw new ConstraintViolationException("entity_type is required");
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new ConstraintViolationException("unknown entity_type: " + raw));
    }
}
