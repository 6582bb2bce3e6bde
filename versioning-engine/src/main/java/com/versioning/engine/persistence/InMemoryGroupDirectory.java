package com.versioning.engine.persistence;

import com.versioning.core.model.ExistenceResult;
import com.versioning.core.repository.GroupDirectory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory user and group directory.
 * Entries are registered by the embedding application or by tests.
 */
public class InMemoryGroupDirectory implements GroupDirectory {

    private final Map<Long, Boolean> users = new ConcurrentHashMap<>();
    private final Map<Long, Boolean> groups = new ConcurrentHashMap<>();
    private final Set<String> memberships = ConcurrentHashMap.newKeySet();

    public InMemoryGroupDirectory addUser(long userId) {
        users.put(userId, false);
        return this;
    }

    public InMemoryGroupDirectory addGroup(long groupId) {
        groups.put(groupId, false);
        return this;
    }

    public InMemoryGroupDirectory addMember(long userId, long groupId) {
        memberships.add(membershipKey(userId, groupId));
        return this;
    }

    public void deleteUser(long userId) {
        users.computeIfPresent(userId, (id, deleted) -> true);
    }

    public void deleteGroup(long groupId) {
        groups.computeIfPresent(groupId, (id, deleted) -> true);
    }

    @Override
    public ExistenceResult userExists(long userId) {
        Boolean deleted = users.get(userId);
        return ExistenceResult.of(deleted != null, Boolean.TRUE.equals(deleted));
    }

    @Override
    public ExistenceResult groupExists(long groupId) {
        Boolean deleted = groups.get(groupId);
        return ExistenceResult.of(deleted != null, Boolean.TRUE.equals(deleted));
    }

    @Override
    public boolean isMember(long userId, long groupId) {
        return memberships.contains(membershipKey(userId, groupId));
    }

    private static String membershipKey(long userId, long groupId) {
        return userId + ":" + groupId;
    }
}
