package com.versioning.core.repository;

import com.versioning.core.model.DeletionPolicy;
import com.versioning.core.model.DependencyEdge;
import com.versioning.core.model.ExistenceResult;
import com.versioning.core.model.ParentCandidate;
import com.versioning.core.model.Resource;
import com.versioning.core.model.ResourceType;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Resource persistence.
 * Resources are never physically deleted; deletion and read-only state come from locks.
 */
public interface ResourceRepository {

    /**
     * Store a new resource.
     *
     * @param resource A resource without an id
     * @return The stored resource with its assigned id
     */
    Resource save(Resource resource);

    /**
     * Find a resource by ID, filtered by deletion state.
     *
     * @param resourceId The resource ID
     * @param deletionPolicy Which deletion states to accept
     * @return The resource if found and accepted by the policy
     */
    Optional<Resource> findById(long resourceId, DeletionPolicy deletionPolicy);

    /**
     * Check existence and deletion state in one lookup.
     *
     * @param resourceId The resource ID
     * @return DOES_NOT_EXIST, EXISTS or DELETED
     */
    ExistenceResult existence(long resourceId);

    /**
     * Look up a prospective parent: its deletion state, its type and whether
     * its type may parent the given child type.
     *
     * @param resourceId The prospective parent resource ID
     * @param childType The type of the child-to-be
     * @return The candidate if the resource exists at all
     */
    Optional<ParentCandidate> findParentCandidate(long resourceId, ResourceType childType);

    /**
     * Repoint the resource's latest snapshot.
     *
     * @param resourceId The resource ID
     * @param snapshotId The new latest snapshot ID
     */
    void updateLatestSnapshot(long resourceId, long snapshotId);

    /**
     * Record a parent/child link between two resources.
     *
     * @param edge The link
     */
    void addDependency(DependencyEdge edge);

    /**
     * Find the children of a resource.
     *
     * @param parentResourceId The parent resource ID
     * @param deletionPolicy Which child deletion states to accept
     * @return Child resources ordered by ID
     */
    List<Resource> findChildren(long parentResourceId, DeletionPolicy deletionPolicy);
}
