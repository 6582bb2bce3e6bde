package com.versioning.engine.validation;

import com.versioning.core.exception.DraftAlreadyExistsException;
import com.versioning.core.exception.DraftSnapshotIdInvalidException;
import com.versioning.core.exception.DraftTargetOwnerMismatchException;
import com.versioning.core.exception.EntityDeletedException;
import com.versioning.core.exception.EntityDoesNotExistException;
import com.versioning.core.exception.MismatchedResourceTypeException;
import com.versioning.core.exception.ReadOnlyLockException;
import com.versioning.core.exception.UserNotInGroupException;
import com.versioning.core.model.DeletionPolicy;
import com.versioning.core.model.ExistenceResult;
import com.versioning.core.model.Resource;
import com.versioning.core.model.ResourceType;
import com.versioning.core.repository.DraftRepository;
import com.versioning.core.repository.GroupDirectory;
import com.versioning.core.repository.ResourceRepository;
import com.versioning.core.repository.SnapshotRepository;

import java.util.Optional;

/**
 * Existence, deletion and relationship assertions shared by the services.
 * Every method reads only; none of them writes.
 */
public class EntityChecks {

    public static final String USER = "user";
    public static final String GROUP = "group";
    public static final String RESOURCE = "resource";
    public static final String SNAPSHOT = "resource_snapshot";
    public static final String DRAFT = "draft";

    private final ResourceRepository resourceRepository;
    private final SnapshotRepository snapshotRepository;
    private final DraftRepository draftRepository;
    private final GroupDirectory groupDirectory;

    public EntityChecks(
            ResourceRepository resourceRepository,
            SnapshotRepository snapshotRepository,
            DraftRepository draftRepository,
            GroupDirectory groupDirectory) {
        this.resourceRepository = resourceRepository;
        this.snapshotRepository = snapshotRepository;
        this.draftRepository = draftRepository;
        this.groupDirectory = groupDirectory;
    }

    /**
     * The user exists and is not deleted.
     */
    public ValidationResult requireUser(long userId) {
        return requireLive(groupDirectory.userExists(userId), USER, "user_id", userId);
    }

    /**
     * The group exists and is not deleted.
     */
    public ValidationResult requireGroup(long groupId) {
        return requireLive(groupDirectory.groupExists(groupId), GROUP, "group_id", groupId);
    }

    public ValidationResult requireMembership(long userId, long groupId) {
        return ValidationResult.check(groupDirectory.isMember(userId, groupId),
            () -> new UserNotInGroupException(userId, groupId));
    }

    /**
     * The resource exists and is not deleted.
     */
    public ValidationResult requireResource(long resourceId) {
        return requireLive(resourceRepository.existence(resourceId), RESOURCE, "resource_id", resourceId);
    }

    /**
     * The resource exists, is not deleted and carries no READONLY lock.
     */
    public ValidationResult requireModifiableResource(long resourceId) {
        Optional<Resource> resource = resourceRepository.findById(resourceId, DeletionPolicy.ANY);
        if (resource.isEmpty()) {
            return ValidationResult.invalid(new EntityDoesNotExistException(RESOURCE, "resource_id", resourceId));
        }
        Resource found = resource.get();
        if (found.deleted()) {
            return ValidationResult.invalid(new EntityDeletedException(found.resourceType().dbName(), resourceId));
        }
        return ValidationResult.check(!found.readOnly(),
            () -> new ReadOnlyLockException(found.resourceType().dbName(), resourceId));
    }

    /**
     * The resource is of the given type.
     */
    public ValidationResult requireResourceType(long resourceId, ResourceType expectedType) {
        ResourceType actualType = resourceRepository.findById(resourceId, DeletionPolicy.ANY)
            .map(Resource::resourceType)
            .orElseThrow(() -> new EntityDoesNotExistException(RESOURCE, "resource_id", resourceId));
        return ValidationResult.check(actualType == expectedType,
            () -> new MismatchedResourceTypeException(expectedType.dbName(), actualType.dbName()));
    }

    public ValidationResult requireSnapshot(long snapshotId) {
        return ValidationResult.check(snapshotRepository.exists(snapshotId),
            () -> new EntityDoesNotExistException(SNAPSHOT, "resource_snapshot_id", snapshotId));
    }

    /**
     * The snapshot is part of the resource's history.
     */
    public ValidationResult requireSnapshotOfResource(long resourceId, long snapshotId) {
        return ValidationResult.check(snapshotRepository.belongsTo(resourceId, snapshotId),
            () -> new DraftSnapshotIdInvalidException(resourceId, snapshotId));
    }

    /**
     * A draft with an explicit id must not exist yet.
     */
    public ValidationResult requireDraftAbsent(Long draftId) {
        return ValidationResult.check(draftId == null || !draftRepository.existsById(draftId),
            () -> new DraftAlreadyExistsException(DRAFT, draftId));
    }

    /**
     * A modification cannot move a resource to another group.
     */
    public ValidationResult requireSameOwner(long draftOwnerId, long resourceId) {
        long resourceOwnerId = resourceRepository.findById(resourceId, DeletionPolicy.ANY)
            .map(Resource::groupId)
            .orElseThrow(() -> new EntityDoesNotExistException(RESOURCE, "resource_id", resourceId));
        return ValidationResult.check(draftOwnerId == resourceOwnerId,
            () -> new DraftTargetOwnerMismatchException(draftOwnerId, resourceOwnerId));
    }

    /**
     * The user holds no draft modification of the resource yet.
     */
    public ValidationResult requireNoModificationByUser(long userId, long resourceId, ResourceType resourceType) {
        return ValidationResult.check(!draftRepository.existsModification(resourceId, userId),
            () -> new DraftAlreadyExistsException(resourceType.dbName(), resourceId));
    }

    private static ValidationResult requireLive(ExistenceResult existence, String entityType,
                                                String attribute, long id) {
        return switch (existence) {
            case EXISTS -> ValidationResult.valid();
            case DELETED -> ValidationResult.invalid(new EntityDeletedException(entityType, id));
            case DOES_NOT_EXIST -> ValidationResult.invalid(new EntityDoesNotExistException(entityType, attribute, id));
        };
    }
}
