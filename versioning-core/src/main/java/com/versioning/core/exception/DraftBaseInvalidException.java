package com.versioning.core.exception;

/**
 * Thrown when a draft's base resource is of a type that may not parent the draft's resource type.
 */
public class DraftBaseInvalidException extends VersioningException {

    public static final String ERROR_CODE = "DRAFT_BASE_INVALID";

    private final long baseResourceId;
    private final String parentType;
    private final String childType;

    public DraftBaseInvalidException(long baseResourceId, String parentType, String childType) {
        super(ERROR_CODE, ErrorKind.INVALID_RELATIONSHIP, String.format(
            "Invalid draft base resource ID: resource type '%s' is not a valid parent of resource type '%s': %d",
            parentType, childType, baseResourceId
        ));
        this.baseResourceId = baseResourceId;
        this.parentType = parentType;
        this.childType = childType;
    }

    public long getBaseResourceId() {
        return baseResourceId;
    }

    public String getParentType() {
        return parentType;
    }

    public String getChildType() {
        return childType;
    }
}
