package com.measurestore.contract;

/**
 * Thrown when a bounded numeric field (confidence, measured value) is outside its valid interval.
 */
public class RangeViolationException extends RuntimeException {

    public RangeViolationException(String message) {
        super(message);
    }
}
