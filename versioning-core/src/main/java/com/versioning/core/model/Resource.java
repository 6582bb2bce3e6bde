package com.versioning.core.model;

import java.time.Instant;

/**
 * Stable identity of a versionable entity.
 *
 * Primary Key: resourceId
 *
 * Invariants:
 * - never physically deleted; deletion is a DELETE lock
 * - deleted and readOnly are derived from locks at read time
 * - latestSnapshotId is repointed on every commit
 */
public record Resource(
    Long resourceId,
    ResourceType resourceType,
    long groupId,
    Instant createdOn,
    Long latestSnapshotId,
    boolean deleted,
    boolean readOnly
) {
    /**
     * Create a resource that has not been stored yet.
     */
    public static Resource create(ResourceType resourceType, long groupId, Instant createdOn) {
        return new Resource(null, resourceType, groupId, createdOn, null, false, false);
    }

    public Resource withId(long resourceId) {
        return new Resource(resourceId, resourceType, groupId, createdOn, latestSnapshotId, deleted, readOnly);
    }

    public Resource withLatestSnapshotId(long snapshotId) {
        return new Resource(resourceId, resourceType, groupId, createdOn, snapshotId, deleted, readOnly);
    }

    /**
     * Check if new snapshots may be committed.
     */
    public boolean isModifiable() {
        return !deleted && !readOnly;
    }
}
