package com.versioning.core.model;

/**
 * Outcome of an existence check that also reports deletion state.
 */
public enum ExistenceResult {
    DOES_NOT_EXIST,
    EXISTS,
    DELETED;

    public static ExistenceResult of(boolean found, boolean deleted) {
        if (!found) {
            return DOES_NOT_EXIST;
        }
        return deleted ? DELETED : EXISTS;
    }
}
