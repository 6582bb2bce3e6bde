package com.versioning.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Payload of a draft resource: a proposal for an entity that does not exist yet.
 */
public record NewResourcePayload(
    JsonNode resourceData,
    Long baseResourceId
) implements DraftPayload {

    public NewResourcePayload {
        if (resourceData == null) {
            resourceData = NullNode.getInstance();
        }
    }

    @Override
    public DraftType type() {
        return DraftType.RESOURCE;
    }

    @Override
    public Long resourceId() {
        return null;
    }

    @Override
    public Long resourceSnapshotId() {
        return null;
    }

    @Override
    public NewResourcePayload withResourceData(JsonNode resourceData) {
        return new NewResourcePayload(resourceData, baseResourceId);
    }
}
