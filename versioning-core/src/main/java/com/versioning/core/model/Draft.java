package com.versioning.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * An uncommitted, user-scoped proposal.
 *
 * Primary Key: draftId
 *
 * Invariants:
 * - creatorId is a member of targetOwnerGroupId
 * - for modifications, targetOwnerGroupId equals the modified resource's group
 * - at most one modification per (resource, creator)
 */
public record Draft(
    Long draftId,
    ResourceType resourceType,
    long targetOwnerGroupId,
    long creatorId,
    DraftPayload payload,
    Instant createdOn,
    Instant lastModifiedOn
) {
    public Draft {
        if (resourceType == null) {
            throw new IllegalArgumentException("Draft resource type is required");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Draft payload is required");
        }
    }

    /**
     * Create a draft resource proposing a brand-new entity.
     */
    public static Draft newResource(
            ResourceType resourceType,
            long targetOwnerGroupId,
            long creatorId,
            JsonNode resourceData,
            Long baseResourceId,
            Instant now) {
        return new Draft(
            null,
            resourceType,
            targetOwnerGroupId,
            creatorId,
            new NewResourcePayload(resourceData, baseResourceId),
            now,
            now
        );
    }

    /**
     * Create a draft modification of an existing resource, branched from the given snapshot.
     */
    public static Draft modification(
            ResourceType resourceType,
            long targetOwnerGroupId,
            long creatorId,
            JsonNode resourceData,
            long resourceId,
            long resourceSnapshotId,
            Instant now) {
        return new Draft(
            null,
            resourceType,
            targetOwnerGroupId,
            creatorId,
            new ModificationPayload(resourceData, resourceId, resourceSnapshotId),
            now,
            now
        );
    }

    public DraftType type() {
        return payload.type();
    }

    public boolean isModification() {
        return payload.type() == DraftType.MODIFICATION;
    }

    public Draft withId(long draftId) {
        return new Draft(draftId, resourceType, targetOwnerGroupId, creatorId, payload, createdOn, lastModifiedOn);
    }

    /**
     * Copy with a new payload and modification timestamp.
     */
    public Draft withPayload(DraftPayload newPayload, Instant modifiedOn) {
        return new Draft(draftId, resourceType, targetOwnerGroupId, creatorId, newPayload, createdOn, modifiedOn);
    }
}
