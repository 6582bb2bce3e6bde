package com.versioning.core.repository;

import com.versioning.core.model.ExistenceResult;

/**
 * Oracle for user and group existence and group membership.
 * Users and groups are managed by an external directory.
 */
public interface GroupDirectory {

    /**
     * Existence and deletion state of a user.
     */
    ExistenceResult userExists(long userId);

    /**
     * Existence and deletion state of a group.
     */
    ExistenceResult groupExists(long groupId);

    /**
     * Check group membership, ignoring deletion state of either side.
     */
    boolean isMember(long userId, long groupId);
}
