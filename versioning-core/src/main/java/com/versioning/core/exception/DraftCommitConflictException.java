package com.versioning.core.exception;

/**
 * Thrown when a draft modification is promoted after its resource moved past
 * the snapshot the draft was branched from.
 */
public class DraftCommitConflictException extends VersioningException {

    public static final String ERROR_CODE = "DRAFT_COMMIT_CONFLICT";

    private final long baseSnapshotId;
    private final long currentSnapshotId;

    public DraftCommitConflictException(String resourceType, long resourceId,
                                        long baseSnapshotId, long currentSnapshotId) {
        super(ERROR_CODE, ErrorKind.CONFLICT, String.format(
            "Draft modifications for a [%s] with id: %d could not be committed: branched from snapshot %d, latest is %d",
            resourceType, resourceId, baseSnapshotId, currentSnapshotId
        ));
        this.baseSnapshotId = baseSnapshotId;
        this.currentSnapshotId = currentSnapshotId;
    }

    public long getBaseSnapshotId() {
        return baseSnapshotId;
    }

    public long getCurrentSnapshotId() {
        return currentSnapshotId;
    }
}
