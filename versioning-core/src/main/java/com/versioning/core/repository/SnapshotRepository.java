package com.versioning.core.repository;

import com.versioning.core.model.ResourceSnapshot;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ResourceSnapshot persistence.
 * Snapshots are immutable once stored; there is no update operation.
 */
public interface SnapshotRepository {

    /**
     * Store a new snapshot.
     *
     * @param snapshot A snapshot without an id
     * @return The stored snapshot with its assigned id
     */
    ResourceSnapshot save(ResourceSnapshot snapshot);

    /**
     * Find a snapshot by ID.
     */
    Optional<ResourceSnapshot> findById(long snapshotId);

    /**
     * Check whether a snapshot exists.
     */
    boolean exists(long snapshotId);

    /**
     * Check whether the snapshot is a snapshot of the given resource.
     *
     * @param resourceId The resource ID
     * @param snapshotId The snapshot ID
     * @return true if both IDs refer to the same resource's history
     */
    boolean belongsTo(long resourceId, long snapshotId);

    /**
     * Full history of a resource.
     *
     * @param resourceId The resource ID
     * @return All snapshots ordered oldest first
     */
    List<ResourceSnapshot> findByResource(long resourceId);
}
