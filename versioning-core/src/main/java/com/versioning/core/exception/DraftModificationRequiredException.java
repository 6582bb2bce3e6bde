package com.versioning.core.exception;

/**
 * Thrown when a snapshot change is attempted on a draft resource.
 * Only draft modifications are pinned to a snapshot.
 */
public class DraftModificationRequiredException extends VersioningException {

    public static final String ERROR_CODE = "DRAFT_MODIFICATION_REQUIRED";

    private final long draftId;

    public DraftModificationRequiredException(long draftId) {
        super(ERROR_CODE, ErrorKind.INVALID_RELATIONSHIP, String.format(
            "Must be a draft modification: %d",
            draftId
        ));
        this.draftId = draftId;
    }

    public long getDraftId() {
        return draftId;
    }
}
