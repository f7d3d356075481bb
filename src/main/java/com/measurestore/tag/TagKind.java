package com.measurestore.tag;

import com.fasterxml.jackson.annotation.JsonValue;
import com.measurestore.contract.ConstraintViolationException;

import java.util.Arrays;

public enum TagKind {
    CAUSE("cause"),
    TOPIC("topic"),
    ESG("esg"),
    SDG("sdg"),
    KEYWORD("keyword");

    private final String value;

    TagKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TagKind fromValue(String raw) {
        if (raw == null) {
            throw new ConstraintViolationException("tag kind is required");
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new ConstraintViolationException("unknown tag kind: " + raw));
    }
}
