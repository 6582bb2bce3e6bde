package com.versioning.core.exception;

/**
 * Thrown when the acting user is not a member of the group that owns (or will own) a resource.
 */
public class UserNotInGroupException extends VersioningException {

    public static final String ERROR_CODE = "USER_NOT_IN_GROUP";

    private final long userId;
    private final long groupId;

    public UserNotInGroupException(long userId, long groupId) {
        super(ERROR_CODE, ErrorKind.MEMBERSHIP_VIOLATION, String.format(
            "User %d is not in group %d",
            userId, groupId
        ));
        this.userId = userId;
        this.groupId = groupId;
    }

    public long getUserId() {
        return userId;
    }

    public long getGroupId() {
        return groupId;
    }
}
