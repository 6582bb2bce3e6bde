package com.versioning.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.versioning.core.exception.MalformedDraftException;
import com.versioning.core.model.DraftPayload;
import com.versioning.core.model.ModificationPayload;
import com.versioning.core.model.NewResourcePayload;

import java.util.List;

/**
 * Converts draft payloads to and from their persisted JSON layout.
 *
 * The stored object always has exactly four keys: resource_data, resource_id,
 * resource_snapshot_id and base_resource_id. A null resource_id marks a draft resource.
 */
public class DraftPayloadCodec {

    public static final String RESOURCE_DATA = "resource_data";
    public static final String RESOURCE_ID = "resource_id";
    public static final String RESOURCE_SNAPSHOT_ID = "resource_snapshot_id";
    public static final String BASE_RESOURCE_ID = "base_resource_id";

    private static final List<String> KEYS = List.of(
        RESOURCE_DATA, RESOURCE_ID, RESOURCE_SNAPSHOT_ID, BASE_RESOURCE_ID);

    private final ObjectMapper objectMapper;

    public DraftPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJson(DraftPayload payload) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set(RESOURCE_DATA, payload.resourceData());
        putNullable(node, RESOURCE_ID, payload.resourceId());
        putNullable(node, RESOURCE_SNAPSHOT_ID, payload.resourceSnapshotId());
        putNullable(node, BASE_RESOURCE_ID, payload.baseResourceId());
        return node;
    }

    public String toJsonString(DraftPayload payload) {
        try {
            return objectMapper.writeValueAsString(toJson(payload));
        } catch (JsonProcessingException e) {
            throw new MalformedDraftException("Failed to serialize draft payload", e);
        }
    }

    /**
     * Rebuild a payload from its stored form.
     *
     * @throws MalformedDraftException if a key is missing or the ids are inconsistent
     */
    public DraftPayload fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedDraftException("Draft payload must be a JSON object");
        }
        for (String key : KEYS) {
            if (!node.has(key)) {
                throw new MalformedDraftException("Draft payload is missing key: " + key);
            }
        }
        if (node.size() != KEYS.size()) {
            throw new MalformedDraftException("Draft payload has unexpected keys: " + node.size());
        }

        JsonNode data = node.get(RESOURCE_DATA);
        Long resourceId = readId(node, RESOURCE_ID);
        Long snapshotId = readId(node, RESOURCE_SNAPSHOT_ID);
        Long baseResourceId = readId(node, BASE_RESOURCE_ID);

        if (resourceId == null) {
            if (snapshotId != null) {
                throw new MalformedDraftException(
                    "Draft resource payload must not carry a resource_snapshot_id: " + snapshotId);
            }
            return new NewResourcePayload(data, baseResourceId);
        }

        if (snapshotId == null) {
            throw new MalformedDraftException(
                "Draft modification payload for resource " + resourceId + " has no resource_snapshot_id");
        }
        if (baseResourceId != null) {
            throw new MalformedDraftException(
                "Draft modification payload must not carry a base_resource_id: " + baseResourceId);
        }
        return new ModificationPayload(data, resourceId, snapshotId);
    }

    public DraftPayload fromJsonString(String json) {
        try {
            return fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedDraftException("Failed to parse draft payload", e);
        }
    }

    private static void putNullable(ObjectNode node, String key, Long value) {
        if (value == null) {
            node.set(key, NullNode.getInstance());
        } else {
            node.put(key, value);
        }
    }

    private static Long readId(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value.isNull()) {
            return null;
        }
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new MalformedDraftException("Draft payload key " + key + " must be an integer: " + value);
        }
        return value.asLong();
    }
}
