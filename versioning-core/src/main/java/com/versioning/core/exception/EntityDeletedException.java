package com.versioning.core.exception;

/**
 * Thrown when a referenced user, group or resource exists but has been deleted.
 */
public class EntityDeletedException extends VersioningException {

    public static final String ERROR_CODE = "ENTITY_DELETED";

    private final String entityType;
    private final long entityId;

    public EntityDeletedException(String entityType, long entityId) {
        super(ERROR_CODE, ErrorKind.DELETED_ENTITY, String.format(
            "The %s with id=%d is deleted",
            entityType != null ? entityType : "entity", entityId
        ));
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public long getEntityId() {
        return entityId;
    }
}
