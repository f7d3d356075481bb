package com.measurestore.contract;

import org.springframework.stereotype.Component;

/**
 * Field-level rules shared by the registry and the fact store. Every check runs before
 * the storage engine is touched.
 */
@Component
public class InputRules {

    public String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConstraintViolationException(field + " is required");
        }
        return value;
    }

    public String requireCodeLength(String value, int length, String field) {
        if (value != null && value.length() != length) {
            throw new ConstraintViolationException(
                field + " must be exactly " + length + " characters when provided, got '" + value + "'");
        }
        return value;
    }

    /**
     * Blank optional text is stored as absent.
     */
    public String optionalText(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public double requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new RangeViolationException(field + " must be a finite number, got " + value);
        }
        return value;
    }

    public Double requireUnitInterval(Double value, String field) {
        if (value == null) {
            return null;
        }
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new RangeViolationException(field + " must lie in [0, 1], got " + value);
        }
        return value;
    }
}
