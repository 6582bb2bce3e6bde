package com.versioning.core.repository;

import com.versioning.core.model.Draft;
import com.versioning.core.model.DraftType;
import com.versioning.core.model.ResourceType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for drafts. Performs no cross-entity validation; callers check
 * invariants before writing.
 */
public interface DraftRepository {

    /**
     * Store a new draft.
     *
     * @param draft A draft without an id
     * @return The stored draft with its assigned id
     * @throws com.versioning.core.exception.DraftAlreadyExistsException if a uniqueness constraint is violated
     */
    Draft save(Draft draft);

    /**
     * Replace the payload and modification time of an existing draft.
     *
     * @param draft The draft with its new state
     * @return true if a row was updated
     */
    boolean update(Draft draft);

    /**
     * Find a draft by ID.
     */
    Optional<Draft> findById(long draftId);

    /**
     * Find a draft by ID, hiding it unless the optional filters match.
     *
     * @param draftId The draft ID
     * @param resourceType Required resource type, or null for any
     * @param creatorId Required creator, or null for any
     */
    Optional<Draft> find(long draftId, ResourceType resourceType, Long creatorId);

    boolean existsById(long draftId);

    /**
     * Delete a draft.
     *
     * @return true if a row was deleted
     */
    boolean deleteById(long draftId);

    /**
     * The draft modification of a resource created by a user.
     */
    Optional<Draft> findModificationByUser(long userId, long resourceId);

    /**
     * Count draft modifications of a resource.
     *
     * @param resourceId The modified resource
     * @param exceptUserId A creator whose drafts are not counted, or null
     */
    int countModifications(long resourceId, Long exceptUserId);

    /**
     * Count drafts matching a filter.
     */
    long countByFilter(DraftFilter filter);

    /**
     * Page of drafts matching a filter, ordered by draft ID.
     *
     * @param filter The filter
     * @param pageStart Row index to start at
     * @param pageLength Maximum rows; zero or negative for unbounded
     */
    List<Draft> findByFilter(DraftFilter filter, int pageStart, int pageLength);

    /**
     * The subset of resource IDs having at least one draft modification.
     *
     * @param resourceIds Resources to check
     * @param userId Only count this creator's drafts, or null for all
     */
    Set<Long> findResourceIdsWithModifications(Collection<Long> resourceIds, Long userId);

    /**
     * Check whether a resource has a draft modification.
     *
     * @param resourceId The resource
     * @param userId Only count this creator's drafts, or null for all
     */
    boolean existsModification(long resourceId, Long userId);

    /**
     * Search criteria for drafts.
     */
    record DraftFilter(
        DraftType draftType,
        ResourceType resourceType,
        long userId,
        Long groupId,
        Long baseResourceId
    ) {
        public boolean matches(Draft draft) {
            return draft.creatorId() == userId
                && draft.resourceType() == resourceType
                && (groupId == null || draft.targetOwnerGroupId() == groupId)
                && (baseResourceId == null || baseResourceId.equals(draft.payload().baseResourceId()))
                && draftType.matches(draft);
        }
    }
}
