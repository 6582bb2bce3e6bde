package com.versioning.engine.coordinator;

import com.versioning.core.exception.DraftCommitConflictException;
import com.versioning.core.exception.DraftDoesNotExistException;
import com.versioning.core.exception.EntityDoesNotExistException;
import com.versioning.core.exception.VersioningException;
import com.versioning.core.model.DeletionPolicy;
import com.versioning.core.model.Draft;
import com.versioning.core.model.DraftPayload;
import com.versioning.core.model.Resource;
import com.versioning.core.model.ResourceSnapshot;
import com.versioning.core.repository.DraftRepository;
import com.versioning.core.repository.ResourceRepository;
import com.versioning.engine.logging.LoggingContext;
import com.versioning.engine.metrics.VersioningMetrics;
import com.versioning.engine.service.ResourceService;
import com.versioning.engine.service.ResourceService.NewResourceRequest;
import com.versioning.engine.service.ResourceService.SnapshotRequest;
import com.versioning.engine.validation.EntityChecks;
import com.versioning.engine.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commits a draft: a draft resource becomes a new resource, a draft
 * modification becomes a new snapshot. The draft is deleted afterwards.
 *
 * All writes happen in the caller's transaction, so a failure part way
 * leaves nothing behind once the caller rolls back.
 */
public class DraftPromotionService {

    private static final Logger log = LoggerFactory.getLogger(DraftPromotionService.class);

    private static final String PROMOTE = "promote_draft";

    private final DraftRepository draftRepository;
    private final ResourceRepository resourceRepository;
    private final ResourceService resourceService;
    private final EntityChecks checks;
    private final VersioningMetrics metrics;

    public DraftPromotionService(
            DraftRepository draftRepository,
            ResourceRepository resourceRepository,
            ResourceService resourceService,
            EntityChecks checks,
            VersioningMetrics metrics) {
        this.draftRepository = draftRepository;
        this.resourceRepository = resourceRepository;
        this.resourceService = resourceService;
        this.checks = checks;
        this.metrics = metrics;
    }

    /**
     * Promote a user's draft.
     *
     * @param draftId The draft to commit
     * @param userId The acting user; must be the draft's creator
     * @return The snapshot written
     * @throws DraftDoesNotExistException if the user has no such draft
     * @throws DraftCommitConflictException if the resource moved past the draft's snapshot
     */
    public ResourceSnapshot promote(long draftId, long userId) {
        try (var ctx = LoggingContext.forDraft(draftId, userId)) {
            enforce(checks.requireUser(userId));
            Draft draft = draftRepository.find(draftId, null, userId)
                .orElseThrow(() -> reject(new DraftDoesNotExistException(draftId)));

            ResourceSnapshot snapshot = draft.isModification()
                ? commitModification(draft)
                : createResource(draft);

            draftRepository.deleteById(draftId);
            metrics.draftPromoted(draft.type().name());

            log.info("Promoted draft {} into snapshot {} of {} {}",
                draftId, snapshot.snapshotId(), snapshot.resourceType(), snapshot.resourceId());
            return snapshot;
        }
    }

    private ResourceSnapshot createResource(Draft draft) {
        DraftPayload payload = draft.payload();
        return resourceService.createResource(new NewResourceRequest(
            draft.resourceType(),
            draft.targetOwnerGroupId(),
            draft.creatorId(),
            payload.resourceData(),
            null,
            payload.baseResourceId()
        ));
    }

    private ResourceSnapshot commitModification(Draft draft) {
        DraftPayload payload = draft.payload();
        long resourceId = payload.resourceId();
        long pinnedSnapshotId = payload.resourceSnapshotId();

        enforce(checks.requireModifiableResource(resourceId));
        Resource resource = resourceRepository.findById(resourceId, DeletionPolicy.NOT_DELETED)
            .orElseThrow(() -> reject(new EntityDoesNotExistException(EntityChecks.RESOURCE, "resource_id", resourceId)));

        if (resource.latestSnapshotId() == null || resource.latestSnapshotId() != pinnedSnapshotId) {
            long current = resource.latestSnapshotId() == null ? -1L : resource.latestSnapshotId();
            log.debug("Draft {} is pinned to snapshot {} but resource {} is at {}",
                draft.draftId(), pinnedSnapshotId, resourceId, current);
            throw reject(new DraftCommitConflictException(
                resource.resourceType().dbName(), resourceId, pinnedSnapshotId, current));
        }

        return resourceService.commitSnapshot(new SnapshotRequest(
            resourceId,
            draft.resourceType(),
            draft.creatorId(),
            payload.resourceData(),
            null
        ));
    }

    private void enforce(ValidationResult result) {
        result.failure().ifPresent(failure -> {
            throw reject(failure);
        });
    }

    private VersioningException reject(VersioningException failure) {
        log.debug("Rejected {}: {} {}", PROMOTE, failure.getErrorCode(), failure.getMessage());
        metrics.rejected(PROMOTE, failure.getErrorCode());
        return failure;
    }
}
