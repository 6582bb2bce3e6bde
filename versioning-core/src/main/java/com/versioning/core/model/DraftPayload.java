package com.versioning.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Content of a draft: either a proposed new resource or a pending edit of an existing one.
 *
 * Two implementations exist, {@link NewResourcePayload} and {@link ModificationPayload}.
 * The accessors that do not apply to a variant return null.
 */
public interface DraftPayload {

    /**
     * The proposed resource data, opaque to the repository.
     */
    JsonNode resourceData();

    /**
     * RESOURCE or MODIFICATION.
     */
    DraftType type();

    /**
     * Intended parent of a new resource, or null.
     */
    Long baseResourceId();

    /**
     * Resource being modified, or null for a draft resource.
     */
    Long resourceId();

    /**
     * Snapshot the modification was branched from, or null for a draft resource.
     */
    Long resourceSnapshotId();

    /**
     * Copy with the resource data replaced.
     */
    DraftPayload withResourceData(JsonNode resourceData);

    static DraftPayload newResource(JsonNode resourceData, Long baseResourceId) {
        return new NewResourcePayload(resourceData, baseResourceId);
    }

    static DraftPayload modification(JsonNode resourceData, long resourceId, long resourceSnapshotId) {
        return new ModificationPayload(resourceData, resourceId, resourceSnapshotId);
    }
}
