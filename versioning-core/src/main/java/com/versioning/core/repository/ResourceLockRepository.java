package com.versioning.core.repository;

import com.versioning.core.model.LockType;
import com.versioning.core.model.ResourceLock;
import java.util.List;

/**
 * Repository for ResourceLock persistence.
 * Locks are append-only: there is no removal.
 */
public interface ResourceLockRepository {

    /**
     * Append a lock.
     *
     * @param lock The lock to add
     * @throws com.versioning.core.exception.LockConflictException if the resource already has a lock of that type
     */
    void add(ResourceLock lock);

    /**
     * Check whether a resource carries a lock of the given type.
     */
    boolean hasLock(long resourceId, LockType lockType);

    /**
     * All locks of a resource, oldest first.
     */
    List<ResourceLock> findByResource(long resourceId);
}
