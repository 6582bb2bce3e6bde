package com.versioning.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One immutable version of a resource's data.
 *
 * Primary Key: snapshotId
 * Foreign Key: (resourceId, resourceType) -> Resource
 */
public record ResourceSnapshot(
    Long snapshotId,
    long resourceId,
    ResourceType resourceType,
    long creatorId,
    Instant createdOn,
    String description,
    JsonNode data
) {
    public static ResourceSnapshot create(
            long resourceId,
            ResourceType resourceType,
            long creatorId,
            String description,
            JsonNode data,
            Instant createdOn) {
        return new ResourceSnapshot(null, resourceId, resourceType, creatorId, createdOn, description, data);
    }

    public ResourceSnapshot withId(long snapshotId) {
        return new ResourceSnapshot(snapshotId, resourceId, resourceType, creatorId, createdOn, description, data);
    }
}
