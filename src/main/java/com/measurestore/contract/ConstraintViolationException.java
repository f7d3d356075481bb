package com.measurestore.contract;

/**
 * Thrown when a dimension field is malformed: wrong ISO code length, a value outside
 * a closed enumeration, or a blank required name.
 */
public class ConstraintViolationException extends RuntimeException {

    public ConstraintViolationException(String message) {
        super(message);
    }
}
