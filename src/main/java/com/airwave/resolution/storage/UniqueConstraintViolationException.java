package com.airwave.resolution.storage;

/**
 * Raised by a repository when an insert collides with an existing row on a unique key.
 * Callers recover by re-reading the row that won the race.
 */
public class UniqueConstraintViolationException extends RuntimeException {

    private final String constraint;
    private final String key;

    public UniqueConstraintViolationException(String constraint, String key) {
        super("Unique constraint '" + constraint + "' violated for key '" + key + "'");
        this.constraint = constraint;
        this.key = key;
    }

    public String getConstraint() {
        return constraint;
    }

    public String getKey() {
        return key;
    }
}
