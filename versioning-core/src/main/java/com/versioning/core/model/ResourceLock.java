package com.versioning.core.model;

import java.time.Instant;

/**
 * Append-only flag on a resource.
 *
 * Primary Key: (resourceId, lockType)
 */
public record ResourceLock(
    long resourceId,
    LockType lockType,
    Instant createdOn
) {}
