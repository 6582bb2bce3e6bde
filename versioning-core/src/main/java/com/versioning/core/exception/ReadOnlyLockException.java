package com.versioning.core.exception;

/**
 * Thrown when a resource with a read-only lock would receive a new snapshot or draft modification.
 */
public class ReadOnlyLockException extends VersioningException {

    public static final String ERROR_CODE = "READ_ONLY_LOCK";

    private final long resourceId;

    public ReadOnlyLockException(String resourceType, long resourceId) {
        super(ERROR_CODE, ErrorKind.LOCKED, String.format(
            "The %s with resource_id=%d has a read-only lock and cannot be modified",
            resourceType != null ? resourceType : "resource", resourceId
        ));
        this.resourceId = resourceId;
    }

    public long getResourceId() {
        return resourceId;
    }
}
