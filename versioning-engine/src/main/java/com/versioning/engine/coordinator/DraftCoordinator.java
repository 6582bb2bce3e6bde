package com.versioning.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.versioning.core.exception.DraftDoesNotExistException;
import com.versioning.core.exception.VersioningException;
import com.versioning.core.model.*;
import com.versioning.core.repository.DraftRepository;
import com.versioning.core.repository.DraftRepository.DraftFilter;
import com.versioning.core.repository.ResourceRepository;
import com.versioning.engine.logging.LoggingContext;
import com.versioning.engine.metrics.VersioningMetrics;
import com.versioning.engine.service.DraftService;
import com.versioning.engine.validation.DraftValidator;
import com.versioning.engine.validation.EntityChecks;
import com.versioning.engine.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Draft coordinator: runs the validation pipeline for each operation, then
 * performs at most one write.
 *
 * Not transactional itself; the caller's transaction covers check and write.
 */
public class DraftCoordinator implements DraftService {

    private static final Logger log = LoggerFactory.getLogger(DraftCoordinator.class);

    private final DraftRepository draftRepository;
    private final ResourceRepository resourceRepository;
    private final EntityChecks checks;
    private final DraftValidator validator;
    private final VersioningMetrics metrics;
    private final Clock clock;

    public DraftCoordinator(
            DraftRepository draftRepository,
            ResourceRepository resourceRepository,
            EntityChecks checks,
            DraftValidator validator,
            VersioningMetrics metrics,
            Clock clock) {
        this.draftRepository = draftRepository;
        this.resourceRepository = resourceRepository;
        this.checks = checks;
        this.validator = validator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Draft createDraftResource(Draft draft) {
        try (var ctx = LoggingContext.forAuthor(draft.creatorId(), draft.targetOwnerGroupId(), null)) {
            enforce("create_draft_resource", validator.validateNewResource(draft));

            Draft stored = draftRepository.save(draft);
            metrics.draftCreated(DraftType.RESOURCE.name(), draft.resourceType().dbName());

            log.info("Created draft resource {} of type {} (base={})",
                stored.draftId(), stored.resourceType(), stored.payload().baseResourceId());
            return stored;
        }
    }

    @Override
    public Draft createDraftModification(Draft draft) {
        try (var ctx = LoggingContext.forAuthor(
                draft.creatorId(), draft.targetOwnerGroupId(), draft.payload().resourceId())) {
            enforce("create_draft_modification", validator.validateModification(draft));

            Draft stored = draftRepository.save(draft);
            metrics.draftCreated(DraftType.MODIFICATION.name(), draft.resourceType().dbName());

            log.info("Created draft modification {} of {} {} at snapshot {}",
                stored.draftId(), stored.resourceType(), stored.payload().resourceId(),
                stored.payload().resourceSnapshotId());
            return stored;
        }
    }

    @Override
    public Optional<Draft> get(long draftId, ResourceType resourceType, Long creatorId) {
        if (creatorId != null) {
            enforce("get_draft", checks.requireUser(creatorId));
        }
        return draftRepository.find(draftId, resourceType, creatorId);
    }

    @Override
    public Draft getOne(long draftId, ResourceType resourceType, Long creatorId) {
        return get(draftId, resourceType, creatorId)
            .orElseThrow(() -> new DraftDoesNotExistException(draftId));
    }

    @Override
    public Optional<Resource> getResource(long resourceId, DeletionPolicy deletionPolicy) {
        return resourceRepository.findById(resourceId, deletionPolicy);
    }

    @Override
    public Optional<Draft> getDraftModificationByUser(long userId, long resourceId) {
        enforce("get_draft_modification", checks.requireUser(userId)
            .then(() -> checks.requireResource(resourceId)));
        return draftRepository.findModificationByUser(userId, resourceId);
    }

    @Override
    public int getNumDraftModifications(long resourceId, Long exceptUserId) {
        ValidationResult result = exceptUserId != null
            ? checks.requireUser(exceptUserId)
            : ValidationResult.valid();
        enforce("count_draft_modifications", result.then(() -> checks.requireResource(resourceId)));
        return draftRepository.countModifications(resourceId, exceptUserId);
    }

    @Override
    public DraftPage getByFiltersPaged(DraftQuery query) {
        ValidationResult result = checks.requireUser(query.userId());
        if (query.groupId() != null) {
            result = result.then(() -> checks.requireGroup(query.groupId()));
        }
        if (query.baseResourceId() != null) {
            result = result.then(() -> checks.requireResource(query.baseResourceId()));
        }
        enforce("search_drafts", result);

        DraftFilter filter = new DraftFilter(
            query.draftType(),
            query.resourceType(),
            query.userId(),
            query.groupId(),
            query.baseResourceId()
        );

        long total = draftRepository.countByFilter(filter);
        List<Draft> drafts = total == 0
            ? List.of()
            : draftRepository.findByFilter(filter, Math.max(0, query.pageStart()), query.pageLength());

        log.debug("Draft search for user {} matched {} drafts, returning {}",
            query.userId(), total, drafts.size());
        return new DraftPage(drafts, total);
    }

    @Override
    public Draft update(Draft draft, JsonNode resourceData, Long resourceSnapshotId) {
        if (draft.draftId() == null) {
            throw new DraftDoesNotExistException(null);
        }
        return update(draft.draftId(), resourceData, resourceSnapshotId);
    }

    @Override
    public Draft update(long draftId, JsonNode resourceData, Long resourceSnapshotId) {
        try (var ctx = LoggingContext.forDraft(draftId, null)) {
            Draft stored = draftRepository.findById(draftId)
                .orElseThrow(() -> reject("update_draft", new DraftDoesNotExistException(draftId)));

            enforce("update_draft", validator.validateSnapshotChange(stored, resourceSnapshotId));

            DraftPayload payload = stored.payload().withResourceData(resourceData);
            if (resourceSnapshotId != null) {
                payload = DraftPayload.modification(resourceData, payload.resourceId(), resourceSnapshotId);
            }
            Draft updated = stored.withPayload(payload, clock.instant());

            if (!draftRepository.update(updated)) {
                throw new DraftDoesNotExistException(draftId);
            }
            metrics.draftUpdated(updated.type().name(), resourceSnapshotId != null);

            log.debug("Updated draft {} (snapshot={})", draftId, updated.payload().resourceSnapshotId());
            return updated;
        }
    }

    @Override
    public void delete(Draft draft) {
        if (draft.draftId() == null) {
            throw new DraftDoesNotExistException(null);
        }
        delete(draft.draftId());
    }

    @Override
    public void delete(long draftId) {
        try (var ctx = LoggingContext.forDraft(draftId, null)) {
            if (!draftRepository.deleteById(draftId)) {
                throw reject("delete_draft", new DraftDoesNotExistException(draftId));
            }
            metrics.draftDeleted();
            log.info("Deleted draft {}", draftId);
        }
    }

    @Override
    public Set<Long> hasDraftModifications(Collection<Long> resourceIds, Long userId) {
        if (resourceIds.isEmpty()) {
            return Set.of();
        }
        return draftRepository.findResourceIdsWithModifications(resourceIds, userId);
    }

    @Override
    public boolean hasDraftModification(long resourceId, Long userId) {
        return draftRepository.existsModification(resourceId, userId);
    }

    // ========== Helper Methods ==========

    private void enforce(String operation, ValidationResult result) {
        result.failure().ifPresent(failure -> {
            throw reject(operation, failure);
        });
    }

    private VersioningException reject(String operation, VersioningException failure) {
        log.debug("Rejected {}: {} {}", operation, failure.getErrorCode(), failure.getMessage());
        metrics.rejected(operation, failure.getErrorCode());
        return failure;
    }
}
