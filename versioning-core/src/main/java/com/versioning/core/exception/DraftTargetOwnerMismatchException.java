package com.versioning.core.exception;

/**
 * Thrown when a draft modification names a different owner group than the resource it modifies.
 */
public class DraftTargetOwnerMismatchException extends VersioningException {

    public static final String ERROR_CODE = "DRAFT_TARGET_OWNER_MISMATCH";

    private final long draftOwnerId;
    private final long resourceOwnerId;

    public DraftTargetOwnerMismatchException(long draftOwnerId, long resourceOwnerId) {
        super(ERROR_CODE, ErrorKind.INVALID_RELATIONSHIP, String.format(
            "Draft modification target owner/resource owner mismatch: %d, %d",
            draftOwnerId, resourceOwnerId
        ));
        this.draftOwnerId = draftOwnerId;
        this.resourceOwnerId = resourceOwnerId;
    }

    public long getDraftOwnerId() {
        return draftOwnerId;
    }

    public long getResourceOwnerId() {
        return resourceOwnerId;
    }
}
