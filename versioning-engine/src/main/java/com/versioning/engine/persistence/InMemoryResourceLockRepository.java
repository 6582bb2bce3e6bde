package com.versioning.engine.persistence;

import com.versioning.core.exception.LockConflictException;
import com.versioning.core.model.LockType;
import com.versioning.core.model.ResourceLock;
import com.versioning.core.repository.ResourceLockRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ResourceLockRepository.
 * For embedding and testing purposes.
 */
public class InMemoryResourceLockRepository implements ResourceLockRepository {

    private final Map<Long, Map<LockType, ResourceLock>> locks = new ConcurrentHashMap<>();

    @Override
    public void add(ResourceLock lock) {
        Map<LockType, ResourceLock> resourceLocks =
            locks.computeIfAbsent(lock.resourceId(), id -> new ConcurrentHashMap<>());
        if (resourceLocks.putIfAbsent(lock.lockType(), lock) != null) {
            throw new LockConflictException(lock.resourceId(), lock.lockType().dbName());
        }
    }

    @Override
    public boolean hasLock(long resourceId, LockType lockType) {
        return locks.getOrDefault(resourceId, Map.of()).containsKey(lockType);
    }

    @Override
    public List<ResourceLock> findByResource(long resourceId) {
        return locks.getOrDefault(resourceId, Map.of()).values().stream()
            .sorted(Comparator.comparing(ResourceLock::createdOn))
            .collect(Collectors.toList());
    }
}
