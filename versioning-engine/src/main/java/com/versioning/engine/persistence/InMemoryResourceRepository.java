package com.versioning.engine.persistence;

import com.versioning.core.model.*;
import com.versioning.core.repository.DependencyRuleRepository;
import com.versioning.core.repository.ResourceLockRepository;
import com.versioning.core.repository.ResourceRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ResourceRepository.
 * Deletion and read-only state are read from the lock repository on every lookup.
 */
public class InMemoryResourceRepository implements ResourceRepository {

    private final Map<Long, Resource> resources = new ConcurrentHashMap<>();
    private final List<DependencyEdge> edges = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong(1);

    private final ResourceLockRepository lockRepository;
    private final DependencyRuleRepository ruleRepository;

    public InMemoryResourceRepository(ResourceLockRepository lockRepository,
                                      DependencyRuleRepository ruleRepository) {
        this.lockRepository = lockRepository;
        this.ruleRepository = ruleRepository;
    }

    @Override
    public Resource save(Resource resource) {
        Resource stored = resource.withId(nextId.getAndIncrement());
        resources.put(stored.resourceId(), stored);
        return stored;
    }

    @Override
    public Optional<Resource> findById(long resourceId, DeletionPolicy deletionPolicy) {
        return Optional.ofNullable(resources.get(resourceId))
            .map(this::withLockState)
            .filter(r -> deletionPolicy.accepts(r.deleted()));
    }

    @Override
    public ExistenceResult existence(long resourceId) {
        return ExistenceResult.of(resources.containsKey(resourceId), isDeleted(resourceId));
    }

    @Override
    public Optional<ParentCandidate> findParentCandidate(long resourceId, ResourceType childType) {
        return Optional.ofNullable(resources.get(resourceId))
            .map(r -> new ParentCandidate(
                resourceId,
                r.resourceType(),
                isDeleted(resourceId),
                ruleRepository.isLegal(r.resourceType(), childType)));
    }

    @Override
    public void updateLatestSnapshot(long resourceId, long snapshotId) {
        resources.computeIfPresent(resourceId, (id, r) -> r.withLatestSnapshotId(snapshotId));
    }

    @Override
    public void addDependency(DependencyEdge edge) {
        edges.add(edge);
    }

    @Override
    public List<Resource> findChildren(long parentResourceId, DeletionPolicy deletionPolicy) {
        return edges.stream()
            .filter(e -> e.parentResourceId() == parentResourceId)
            .map(e -> findById(e.childResourceId(), deletionPolicy))
            .flatMap(Optional::stream)
            .sorted(Comparator.comparing(Resource::resourceId))
            .collect(Collectors.toList());
    }

    private boolean isDeleted(long resourceId) {
        return lockRepository.hasLock(resourceId, LockType.DELETE);
    }

    private Resource withLockState(Resource r) {
        return new Resource(
            r.resourceId(),
            r.resourceType(),
            r.groupId(),
            r.createdOn(),
            r.latestSnapshotId(),
            isDeleted(r.resourceId()),
            lockRepository.hasLock(r.resourceId(), LockType.READONLY)
        );
    }
}
