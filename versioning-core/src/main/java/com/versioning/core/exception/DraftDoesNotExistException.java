package com.versioning.core.exception;

/**
 * Thrown when a requested draft is not found.
 */
public class DraftDoesNotExistException extends VersioningException {

    public static final String ERROR_CODE = "DRAFT_NOT_FOUND";

    private final Long draftId;

    public DraftDoesNotExistException(Long draftId) {
        super(ERROR_CODE, ErrorKind.NOT_FOUND, String.format(
            "The requested draft with id=%s does not exist",
            draftId
        ));
        this.draftId = draftId;
    }

    public Long getDraftId() {
        return draftId;
    }
}
