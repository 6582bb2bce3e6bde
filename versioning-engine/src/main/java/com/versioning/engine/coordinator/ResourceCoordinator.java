package com.versioning.engine.coordinator;

import com.versioning.core.exception.EntityDeletedException;
import com.versioning.core.exception.EntityDoesNotExistException;
import com.versioning.core.exception.InvalidDependencyException;
import com.versioning.core.exception.MismatchedResourceTypeException;
import com.versioning.core.exception.VersioningException;
import com.versioning.core.model.*;
import com.versioning.core.repository.ResourceLockRepository;
import com.versioning.core.repository.ResourceRepository;
import com.versioning.core.repository.SnapshotRepository;
import com.versioning.engine.logging.LoggingContext;
import com.versioning.engine.metrics.VersioningMetrics;
import com.versioning.engine.service.ResourceService;
import com.versioning.engine.validation.EntityChecks;
import com.versioning.engine.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resource history coordinator.
 * Appends snapshots and locks; existing snapshots are never rewritten.
 */
public class ResourceCoordinator implements ResourceService {

    private static final Logger log = LoggerFactory.getLogger(ResourceCoordinator.class);

    private final ResourceRepository resourceRepository;
    private final SnapshotRepository snapshotRepository;
    private final ResourceLockRepository lockRepository;
    private final EntityChecks checks;
    private final VersioningMetrics metrics;
    private final Clock clock;

    public ResourceCoordinator(
            ResourceRepository resourceRepository,
            SnapshotRepository snapshotRepository,
            ResourceLockRepository lockRepository,
            EntityChecks checks,
            VersioningMetrics metrics,
            Clock clock) {
        this.resourceRepository = resourceRepository;
        this.snapshotRepository = snapshotRepository;
        this.lockRepository = lockRepository;
        this.checks = checks;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public ResourceSnapshot createResource(NewResourceRequest request) {
        try (var ctx = LoggingContext.forAuthor(request.creatorId(), request.groupId(), request.parentResourceId())) {
            Optional<ParentCandidate> parent = request.parentResourceId() == null
                ? Optional.empty()
                : resourceRepository.findParentCandidate(request.parentResourceId(), request.resourceType());

            enforce("create_resource", checks.requireGroup(request.groupId())
                .then(() -> checks.requireUser(request.creatorId()))
                .then(() -> checks.requireMembership(request.creatorId(), request.groupId()))
                .then(() -> requireParent(request.parentResourceId(), parent, request.resourceType())));

            Instant now = clock.instant();
            Resource resource = resourceRepository.save(
                Resource.create(request.resourceType(), request.groupId(), now));
            ResourceSnapshot snapshot = snapshotRepository.save(ResourceSnapshot.create(
                resource.resourceId(),
                request.resourceType(),
                request.creatorId(),
                request.description(),
                request.data(),
                now
            ));
            resourceRepository.updateLatestSnapshot(resource.resourceId(), snapshot.snapshotId());

            parent.ifPresent(p -> resourceRepository.addDependency(new DependencyEdge(
                p.resourceId(), p.resourceType(), resource.resourceId(), request.resourceType())));

            metrics.resourceCreated(request.resourceType().dbName());
            log.info("Created {} resource {} with snapshot {}",
                request.resourceType(), resource.resourceId(), snapshot.snapshotId());
            return snapshot;
        }
    }

    @Override
    public ResourceSnapshot commitSnapshot(SnapshotRequest request) {
        try (var ctx = LoggingContext.forAuthor(request.creatorId(), null, request.resourceId())) {
            enforce("commit_snapshot", checks.requireModifiableResource(request.resourceId()));

            Resource resource = resourceRepository.findById(request.resourceId(), DeletionPolicy.NOT_DELETED)
                .orElseThrow(() -> new EntityDoesNotExistException(
                    EntityChecks.RESOURCE, "resource_id", request.resourceId()));

            enforce("commit_snapshot", ValidationResult.check(
                    resource.resourceType() == request.resourceType(),
                    () -> new MismatchedResourceTypeException(
                        request.resourceType().dbName(), resource.resourceType().dbName()))
                .then(() -> checks.requireUser(request.creatorId()))
                .then(() -> checks.requireMembership(request.creatorId(), resource.groupId())));

            ResourceSnapshot snapshot = snapshotRepository.save(ResourceSnapshot.create(
                resource.resourceId(),
                resource.resourceType(),
                request.creatorId(),
                request.description(),
                request.data(),
                clock.instant()
            ));
            resourceRepository.updateLatestSnapshot(resource.resourceId(), snapshot.snapshotId());

            metrics.snapshotCommitted(resource.resourceType().dbName());
            log.info("Committed snapshot {} of {} {}",
                snapshot.snapshotId(), resource.resourceType(), resource.resourceId());
            return snapshot;
        }
    }

    @Override
    public void deleteResource(long resourceId) {
        addLock(resourceId, LockType.DELETE);
    }

    @Override
    public void markReadOnly(long resourceId) {
        addLock(resourceId, LockType.READONLY);
    }

    @Override
    public Optional<ResourceSnapshot> getLatestSnapshot(long resourceId, DeletionPolicy deletionPolicy) {
        return resourceRepository.findById(resourceId, deletionPolicy)
            .map(Resource::latestSnapshotId)
            .flatMap(snapshotRepository::findById);
    }

    @Override
    public List<ResourceSnapshot> getHistory(long resourceId) {
        if (resourceRepository.findById(resourceId, DeletionPolicy.ANY).isEmpty()) {
            throw new EntityDoesNotExistException(EntityChecks.RESOURCE, "resource_id", resourceId);
        }
        return snapshotRepository.findByResource(resourceId);
    }

    @Override
    public List<Resource> getChildren(long parentResourceId, DeletionPolicy deletionPolicy) {
        return resourceRepository.findChildren(parentResourceId, deletionPolicy);
    }

    // ========== Helper Methods ==========

    private void addLock(long resourceId, LockType lockType) {
        try (var ctx = LoggingContext.forResource(resourceId)) {
            Resource resource = resourceRepository.findById(resourceId, DeletionPolicy.ANY)
                .orElseThrow(() -> reject("add_lock",
                    new EntityDoesNotExistException(EntityChecks.RESOURCE, "resource_id", resourceId)));
            if (resource.deleted()) {
                throw reject("add_lock", new EntityDeletedException(resource.resourceType().dbName(), resourceId));
            }

            lockRepository.add(new ResourceLock(resourceId, lockType, clock.instant()));

            metrics.lockAdded(lockType.dbName());
            log.info("Added {} lock to {} {}", lockType, resource.resourceType(), resourceId);
        }
    }

    /**
     * Parent must exist, be live, and be of a type that may parent the child type.
     */
    private ValidationResult requireParent(Long parentResourceId, Optional<ParentCandidate> parent,
                                           ResourceType childType) {
        if (parentResourceId == null) {
            return ValidationResult.valid();
        }
        if (parent.isEmpty()) {
            return ValidationResult.invalid(
                new EntityDoesNotExistException(EntityChecks.RESOURCE, "resource_id", parentResourceId));
        }
        ParentCandidate candidate = parent.get();
        if (candidate.deleted()) {
            return ValidationResult.invalid(
                new EntityDeletedException(candidate.resourceType().dbName(), parentResourceId));
        }
        return ValidationResult.check(candidate.legalParent(), () -> new InvalidDependencyException(
            parentResourceId, candidate.resourceType().dbName(), childType.dbName()));
    }

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
