package com.versioning.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.versioning.core.model.DeletionPolicy;
import com.versioning.core.model.Resource;
import com.versioning.core.model.ResourceSnapshot;
import com.versioning.core.model.ResourceType;

import java.util.List;
import java.util.Optional;

/**
 * Committed resource history: creation, snapshots, soft deletion and read-only freezes.
 * Snapshots are never mutated; each commit appends one.
 */
public interface ResourceService {

    /**
     * Create a resource together with its first snapshot.
     *
     * @param request The creation request
     * @return The first snapshot; its resource id names the new resource
     * @throws com.versioning.core.exception.InvalidDependencyException if the parent type may not parent the new type
     */
    ResourceSnapshot createResource(NewResourceRequest request);

    /**
     * Append a snapshot and make it the latest.
     *
     * @param request The commit request
     * @return The new snapshot
     * @throws com.versioning.core.exception.ReadOnlyLockException if the resource is frozen
     */
    ResourceSnapshot commitSnapshot(SnapshotRequest request);

    /**
     * Soft-delete a resource by adding a DELETE lock.
     *
     * @throws com.versioning.core.exception.EntityDeletedException if already deleted
     */
    void deleteResource(long resourceId);

    /**
     * Freeze a resource by adding a READONLY lock.
     */
    void markReadOnly(long resourceId);

    /**
     * The snapshot the resource's latest pointer names.
     */
    Optional<ResourceSnapshot> getLatestSnapshot(long resourceId, DeletionPolicy deletionPolicy);

    /**
     * Full history, oldest first.
     */
    List<ResourceSnapshot> getHistory(long resourceId);

    /**
     * Resources recorded as children of the given one.
     */
    List<Resource> getChildren(long parentResourceId, DeletionPolicy deletionPolicy);

    /**
     * Request to create a resource.
     */
    record NewResourceRequest(
        ResourceType resourceType,
        long groupId,
        long creatorId,
        JsonNode data,
        String description,
        Long parentResourceId
    ) {}

    /**
     * Request to commit a new snapshot of an existing resource.
     */
    record SnapshotRequest(
        long resourceId,
        ResourceType resourceType,
        long creatorId,
        JsonNode data,
        String description
    ) {}
}
