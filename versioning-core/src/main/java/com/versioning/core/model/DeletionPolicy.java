package com.versioning.core.model;

/**
 * Caller preference with respect to deleted entities when looking them up.
 */
public enum DeletionPolicy {
    /**
     * Disregard deletion state.
     */
    ANY,

    /**
     * Non-deleted entities only.
     */
    NOT_DELETED,

    /**
     * Deleted entities only.
     */
    DELETED;

    /**
     * Check whether an entity with the given deletion state passes this policy.
     */
    public boolean accepts(boolean deleted) {
        return switch (this) {
            case ANY -> true;
            case NOT_DELETED -> !deleted;
            case DELETED -> deleted;
        };
    }
}
