package com.versioning.core.exception;

/**
 * Thrown when a draft, or its stored payload, does not have the shape the operation needs.
 */
public class MalformedDraftException extends VersioningException {

    public static final String ERROR_CODE = "MALFORMED_DRAFT";

    public MalformedDraftException(String message) {
        super(ERROR_CODE, ErrorKind.MALFORMED, message);
    }

    public MalformedDraftException(String message, Throwable cause) {
        super(ERROR_CODE, ErrorKind.MALFORMED, message, cause);
    }
}
