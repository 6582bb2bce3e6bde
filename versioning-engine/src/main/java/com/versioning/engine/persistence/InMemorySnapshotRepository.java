package com.versioning.engine.persistence;

import com.versioning.core.model.ResourceSnapshot;
import com.versioning.core.repository.SnapshotRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SnapshotRepository.
 * For embedding and testing purposes.
 */
public class InMemorySnapshotRepository implements SnapshotRepository {

    private final Map<Long, ResourceSnapshot> snapshots = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    @Override
    public ResourceSnapshot save(ResourceSnapshot snapshot) {
        ResourceSnapshot stored = snapshot.withId(nextId.getAndIncrement());
        snapshots.put(stored.snapshotId(), stored);
        return stored;
    }

    @Override
    public Optional<ResourceSnapshot> findById(long snapshotId) {
        return Optional.ofNullable(snapshots.get(snapshotId));
    }

    @Override
    public boolean exists(long snapshotId) {
        return snapshots.containsKey(snapshotId);
    }

    @Override
    public boolean belongsTo(long resourceId, long snapshotId) {
        ResourceSnapshot snapshot = snapshots.get(snapshotId);
        return snapshot != null && snapshot.resourceId() == resourceId;
    }

    @Override
    public List<ResourceSnapshot> findByResource(long resourceId) {
        return snapshots.values().stream()
            .filter(s -> s.resourceId() == resourceId)
            .sorted(Comparator.comparing(ResourceSnapshot::snapshotId))
            .collect(Collectors.toList());
    }
}
