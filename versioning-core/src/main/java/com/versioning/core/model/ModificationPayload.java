package com.versioning.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Payload of a draft modification: a pending new snapshot of an existing resource,
 * pinned to the snapshot it was branched from.
 */
public record ModificationPayload(
    JsonNode resourceData,
    Long resourceId,
    Long resourceSnapshotId
) implements DraftPayload {

    public ModificationPayload {
        if (resourceId == null) {
            throw new IllegalArgumentException("Draft modification requires a resource id");
        }
        if (resourceSnapshotId == null) {
            throw new IllegalArgumentException("Draft modification requires a resource snapshot id");
        }
        if (resourceData == null) {
            resourceData = NullNode.getInstance();
        }
    }

    @Override
    public DraftType type() {
        return DraftType.MODIFICATION;
    }

    @Override
    public Long baseResourceId() {
        return null;
    }

    @Override
    public ModificationPayload withResourceData(JsonNode resourceData) {
        return new ModificationPayload(resourceData, resourceId, resourceSnapshotId);
    }
}
