package com.versioning.core.exception;

/**
 * Thrown when a snapshot id does not identify a snapshot of the resource it is claimed to belong to.
 */
public class DraftSnapshotIdInvalidException extends VersioningException {

    public static final String ERROR_CODE = "DRAFT_SNAPSHOT_ID_INVALID";

    private final long resourceId;
    private final long resourceSnapshotId;

    public DraftSnapshotIdInvalidException(long resourceId, long resourceSnapshotId) {
        super(ERROR_CODE, ErrorKind.INVALID_RELATIONSHIP, String.format(
            "Resource snapshot %d is not a snapshot of resource %d",
            resourceSnapshotId, resourceId
        ));
        this.resourceId = resourceId;
        this.resourceSnapshotId = resourceSnapshotId;
    }

    public long getResourceId() {
        return resourceId;
    }

    public long getResourceSnapshotId() {
        return resourceSnapshotId;
    }
}
