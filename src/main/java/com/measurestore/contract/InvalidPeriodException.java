package com.measurestore.contract;

/**
 * Thrown when a period request populates zero or several value fields, or the populated
 * field does not match the requested kind.
 */
public class InvalidPeriodException extends RuntimeException {

    public InvalidPeriodException(String message) {
        super(message);
    }
}
