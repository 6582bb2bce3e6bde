package com.versioning.engine.validation;

import com.versioning.core.exception.DraftBaseInvalidException;
import com.versioning.core.exception.DraftModificationRequiredException;
import com.versioning.core.exception.EntityDeletedException;
import com.versioning.core.exception.EntityDoesNotExistException;
import com.versioning.core.exception.MalformedDraftException;
import com.versioning.core.model.Draft;
import com.versioning.core.model.DraftPayload;
import com.versioning.core.model.ParentCandidate;
import com.versioning.core.model.ResourceType;
import com.versioning.core.repository.ResourceRepository;

import java.util.Optional;

/**
 * Precondition pipelines for draft writes.
 * Each pipeline returns the first failing check; nothing is written here.
 */
public class DraftValidator {

    private final EntityChecks checks;
    private final ResourceRepository resourceRepository;

    public DraftValidator(EntityChecks checks, ResourceRepository resourceRepository) {
        this.checks = checks;
        this.resourceRepository = resourceRepository;
    }

    /**
     * Checks for a draft proposing a new resource.
     */
    public ValidationResult validateNewResource(Draft draft) {
        if (draft.isModification()) {
            return ValidationResult.invalid(new MalformedDraftException(
                "Expected a draft resource payload but got a modification of resource "
                    + draft.payload().resourceId()));
        }
        return requireAuthor(draft)
            .then(() -> requireBase(draft.payload().baseResourceId(), draft.resourceType()));
    }

    /**
     * Checks for a draft modifying an existing resource.
     */
    public ValidationResult validateModification(Draft draft) {
        if (!draft.isModification()) {
            return ValidationResult.invalid(new MalformedDraftException(
                "Expected a draft modification payload but got a draft resource"));
        }
        long resourceId = draft.payload().resourceId();
        long snapshotId = draft.payload().resourceSnapshotId();

        return requireAuthor(draft)
            .then(() -> checks.requireModifiableResource(resourceId))
            .then(() -> checks.requireResourceType(resourceId, draft.resourceType()))
            .then(() -> checks.requireSnapshot(snapshotId))
            .then(() -> checks.requireSnapshotOfResource(resourceId, snapshotId))
            .then(() -> checks.requireSameOwner(draft.targetOwnerGroupId(), resourceId))
            .then(() -> checks.requireNoModificationByUser(draft.creatorId(), resourceId, draft.resourceType()));
    }

    /**
     * Checks for re-pinning a stored draft to another snapshot.
     * A null snapshot id means the pin is left unchanged.
     */
    public ValidationResult validateSnapshotChange(Draft stored, Long newSnapshotId) {
        if (newSnapshotId == null) {
            return ValidationResult.valid();
        }
        DraftPayload payload = stored.payload();
        if (!stored.isModification()) {
            return ValidationResult.invalid(new DraftModificationRequiredException(stored.draftId()));
        }
        return checks.requireSnapshot(newSnapshotId)
            .then(() -> checks.requireSnapshotOfResource(payload.resourceId(), newSnapshotId));
    }

    private ValidationResult requireAuthor(Draft draft) {
        return checks.requireDraftAbsent(draft.draftId())
            .then(() -> checks.requireGroup(draft.targetOwnerGroupId()))
            .then(() -> checks.requireUser(draft.creatorId()))
            .then(() -> checks.requireMembership(draft.creatorId(), draft.targetOwnerGroupId()));
    }

    /**
     * One lookup yields deletion state and rule legality. Deletion wins over legality.
     */
    private ValidationResult requireBase(Long baseResourceId, ResourceType childType) {
        if (baseResourceId == null) {
            return ValidationResult.valid();
        }
        Optional<ParentCandidate> candidate = resourceRepository.findParentCandidate(baseResourceId, childType);
        if (candidate.isEmpty()) {
            return ValidationResult.invalid(
                new EntityDoesNotExistException(EntityChecks.RESOURCE, "resource_id", baseResourceId));
        }
        ParentCandidate base = candidate.get();
        if (base.deleted()) {
            return ValidationResult.invalid(
                new EntityDeletedException(base.resourceType().dbName(), baseResourceId));
        }
        return ValidationResult.check(base.legalParent(), () -> new DraftBaseInvalidException(
            baseResourceId, base.resourceType().dbName(), childType.dbName()));
    }
}
