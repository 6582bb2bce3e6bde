package com.versioning.core.exception;

/**
 * Thrown when a resource or snapshot has a different type than the operation expects.
 */
public class MismatchedResourceTypeException extends VersioningException {

    public static final String ERROR_CODE = "MISMATCHED_RESOURCE_TYPE";

    public MismatchedResourceTypeException(String expectedType, String foundType) {
        super(ERROR_CODE, ErrorKind.INVALID_RELATIONSHIP, String.format(
            "Expected resource type '%s': %s",
            expectedType, foundType
        ));
    }
}
