package com.versioning.core.exception;

/**
 * Thrown when a parent/child link between two resources is not permitted by the dependency rules.
 */
public class InvalidDependencyException extends VersioningException {

    public static final String ERROR_CODE = "INVALID_DEPENDENCY";

    public InvalidDependencyException(long parentResourceId, String parentType, String childType) {
        super(ERROR_CODE, ErrorKind.INVALID_RELATIONSHIP, String.format(
            "Resource %d of type '%s' may not parent a resource of type '%s'",
            parentResourceId, parentType, childType
        ));
    }
}
