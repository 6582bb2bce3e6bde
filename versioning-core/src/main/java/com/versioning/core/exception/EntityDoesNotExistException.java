package com.versioning.core.exception;

/**
 * Thrown when a referenced user, group, resource or snapshot does not exist.
 */
public class EntityDoesNotExistException extends VersioningException {

    public static final String ERROR_CODE = "ENTITY_NOT_FOUND";

    private final String entityType;
    private final String attribute;
    private final Object value;

    public EntityDoesNotExistException(String entityType, String attribute, Object value) {
        super(ERROR_CODE, ErrorKind.NOT_FOUND, String.format(
            "Failed to locate %s with %s=%s",
            entityType != null ? entityType : "an entity", attribute, value
        ));
        this.entityType = entityType;
        this.attribute = attribute;
        this.value = value;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getAttribute() {
        return attribute;
    }

    public Object getValue() {
        return value;
    }
}
