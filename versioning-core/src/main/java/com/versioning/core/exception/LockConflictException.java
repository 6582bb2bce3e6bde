package com.versioning.core.exception;

/**
 * Thrown when a lock of the same type is already present on a resource.
 */
public class LockConflictException extends VersioningException {

    public static final String ERROR_CODE = "LOCK_CONFLICT";

    public LockConflictException(long resourceId, String lockType) {
        super(ERROR_CODE, ErrorKind.DUPLICATE, String.format(
            "Resource %d already has a '%s' lock",
            resourceId, lockType
        ));
    }
}
