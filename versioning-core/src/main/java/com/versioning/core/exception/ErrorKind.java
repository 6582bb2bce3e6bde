package com.versioning.core.exception;

/**
 * Coarse classification of repository failures.
 * Callers translate these into user-visible responses; none of them is retryable.
 */
public enum ErrorKind {
    /**
     * A referenced draft, resource, snapshot, user or group does not exist.
     */
    NOT_FOUND,

    /**
     * A referenced user, group or resource exists but is tombstoned.
     */
    DELETED_ENTITY,

    /**
     * The acting user is not a member of the target group.
     */
    MEMBERSHIP_VIOLATION,

    /**
     * The write would duplicate an existing draft, entity or lock.
     */
    DUPLICATE,

    /**
     * Entities exist but are not related the way the operation requires.
     */
    INVALID_RELATIONSHIP,

    /**
     * The resource carries a lock that forbids the operation.
     */
    LOCKED,

    /**
     * The draft was branched from a snapshot that is no longer the latest.
     */
    CONFLICT,

    /**
     * The draft or its stored payload has an impossible shape.
     */
    MALFORMED
}
