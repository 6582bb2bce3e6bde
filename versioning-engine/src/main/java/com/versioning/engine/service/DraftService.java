package com.versioning.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.versioning.core.model.DeletionPolicy;
import com.versioning.core.model.Draft;
import com.versioning.core.model.DraftType;
import com.versioning.core.model.Resource;
import com.versioning.core.model.ResourceType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drafts repository: creation, retrieval, paged search, update and deletion of
 * drafts, with every cross-entity invariant checked before a write.
 *
 * Implementations never commit; the caller owns the transaction.
 */
public interface DraftService {

    /**
     * Persist a draft proposing a new resource.
     *
     * @param draft A draft resource; its id is normally null
     * @return The stored draft with its id assigned
     * @throws com.versioning.core.exception.EntityDeletedException if the base resource is deleted
     * @throws com.versioning.core.exception.DraftBaseInvalidException if the base type may not parent the draft's type
     */
    Draft createDraftResource(Draft draft);

    /**
     * Persist a draft modification of an existing resource.
     *
     * @param draft A draft modification pinned to a snapshot of its resource
     * @return The stored draft with its id assigned
     * @throws com.versioning.core.exception.DraftAlreadyExistsException if the creator already holds one for the resource
     * @throws com.versioning.core.exception.DraftSnapshotIdInvalidException if the snapshot is not of the resource
     */
    Draft createDraftModification(Draft draft);

    /**
     * Get a draft of either kind.
     *
     * @param draftId The draft ID
     * @param resourceType Hide the draft unless it is of this type; null for any
     * @param creatorId Hide the draft unless created by this user; null for any
     * @return The draft, or empty if absent or hidden by a filter
     */
    Optional<Draft> get(long draftId, ResourceType resourceType, Long creatorId);

    /**
     * Same as {@link #get}, but fails instead of returning empty.
     *
     * @throws com.versioning.core.exception.DraftDoesNotExistException if absent or hidden by a filter
     */
    Draft getOne(long draftId, ResourceType resourceType, Long creatorId);

    /**
     * Look up a resource, filtered by deletion state.
     */
    Optional<Resource> getResource(long resourceId, DeletionPolicy deletionPolicy);

    /**
     * The draft modification of a resource created by a user, if any.
     */
    Optional<Draft> getDraftModificationByUser(long userId, long resourceId);

    /**
     * Count the draft modifications of a resource.
     *
     * @param resourceId The resource
     * @param exceptUserId A user whose draft is not counted, or null
     */
    int getNumDraftModifications(long resourceId, Long exceptUserId);

    /**
     * A page of a user's drafts, ordered by draft id, and the total match count.
     */
    DraftPage getByFiltersPaged(DraftQuery query);

    /**
     * Replace a draft's resource data, optionally re-pinning a modification.
     *
     * @param draft A stored draft
     * @param resourceData New resource data
     * @param resourceSnapshotId New snapshot of the same resource, or null to keep the pin
     * @return The updated draft
     */
    Draft update(Draft draft, JsonNode resourceData, Long resourceSnapshotId);

    /**
     * Same as {@link #update(Draft, JsonNode, Long)} by draft ID.
     */
    Draft update(long draftId, JsonNode resourceData, Long resourceSnapshotId);

    /**
     * Delete a draft.
     *
     * @throws com.versioning.core.exception.DraftDoesNotExistException if it does not exist
     */
    void delete(Draft draft);

    void delete(long draftId);

    /**
     * Which of the resources have at least one draft modification.
     *
     * @param resourceIds Resources to check
     * @param userId Only count this user's drafts, or null for all users
     * @return The subset of resource IDs with drafts
     */
    Set<Long> hasDraftModifications(Collection<Long> resourceIds, Long userId);

    boolean hasDraftModification(long resourceId, Long userId);

    /**
     * Search criteria for drafts.
     *
     * @param pageLength Maximum drafts returned; zero or negative for unbounded
     */
    record DraftQuery(
        DraftType draftType,
        ResourceType resourceType,
        long userId,
        Long groupId,
        Long baseResourceId,
        int pageStart,
        int pageLength
    ) {
        public static DraftQuery all(DraftType draftType, ResourceType resourceType, long userId) {
            return new DraftQuery(draftType, resourceType, userId, null, null, 0, 0);
        }
    }

    /**
     * One page of search results.
     */
    record DraftPage(
        List<Draft> drafts,
        long totalCount
    ) {}
}
