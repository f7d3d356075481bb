package com.measurestore.store;

/**
 * Raised by the storage engine when an insert collides with an existing natural key.
 * Carries the id of the row that already holds the key.
 */
public class UniqueKeyConflictException extends RuntimeException {

    private final String index;
    private final long existingId;

    public UniqueKeyConflictException(String index, Object key, long existingId) {
        super("unique key " + index + " already holds " + key + " (id=" + existingId + ")");
        this.index = index;
        this.existingId = existingId;
    }

    public String getIndex() {
        return index;
    }

    public long getExistingId() {
        return existingId;
    }
}
