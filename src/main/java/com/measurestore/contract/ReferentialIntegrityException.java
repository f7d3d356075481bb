package com.measurestore.contract;

/**
 * Thrown when a referenced row does not exist, or when a delete is blocked by
 * rows that still depend on the target.
 */
public class ReferentialIntegrityException extends RuntimeException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }

    public static ReferentialIntegrityException missing(String table, long id) {
        return new ReferentialIntegrityException(table + " not found: " + id);
    }

    public static ReferentialIntegrityException restricted(String table, long id, long dependents, String dependentTable) {
        return new ReferentialIntegrityException(
            "cannot delete " + table + " " + id + ": referenced by " + dependents + " " + dependentTable);
    }
}
