package com.versioning.core.exception;

/**
 * Base exception for all versioning and draft errors.
 */
public class VersioningException extends RuntimeException {

    private final String errorCode;
    private final ErrorKind kind;

    public VersioningException(String errorCode, ErrorKind kind, String message) {
        super(message);
        this.errorCode = errorCode;
        this.kind = kind;
    }

    public VersioningException(String errorCode, ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.kind = kind;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
