package com.versioning.core.exception;

/**
 * Thrown when a draft with the same id already exists, or when a user already
 * holds a draft modification of the same resource.
 */
public class DraftAlreadyExistsException extends VersioningException {

    public static final String ERROR_CODE = "DRAFT_ALREADY_EXISTS";

    private final String resourceType;
    private final long id;

    public DraftAlreadyExistsException(String resourceType, long id) {
        super(ERROR_CODE, ErrorKind.DUPLICATE, String.format(
            "A draft for a [%s] with id: %d already exists",
            resourceType, id
        ));
        this.resourceType = resourceType;
        this.id = id;
    }

    public String getResourceType() {
        return resourceType;
    }

    public long getId() {
        return id;
    }
}
