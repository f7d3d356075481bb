package com.measurestore.registry;

import com.fasterxml.jackson.annotation.JsonValue;
import com.measurestore.contract.ConstraintViolationException;

import java.util.Arrays;

/**
 * Which way a metric improves. Stored and exchanged as -1, 0 or +1.
 */
public enum MetricDirection {
    LOWER_IS_BETTER(-1),
    NEUTRAL(0),
    HIGHER_IS_BETTER(1);

    private final int code;

    MetricDirection(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    public static MetricDirection fromCode(Integer raw) {
        if (raw == null) {
            return NEUTRAL;
        }
        return Arrays.stream(values())
            .filter(v -> v.code == raw)
            .findFirst()
            .orElseThrow(() -> new ConstraintViolationException("direction must be -1, 0 or 1, got " + raw));
    }
}
