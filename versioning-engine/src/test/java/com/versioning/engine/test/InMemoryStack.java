package com.versioning.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.versioning.core.model.ResourceSnapshot;
import com.versioning.core.model.ResourceType;
import com.versioning.engine.coordinator.DraftCoordinator;
import com.versioning.engine.coordinator.DraftPromotionService;
import com.versioning.engine.coordinator.ResourceCoordinator;
import com.versioning.engine.metrics.VersioningMetrics;
import com.versioning.engine.persistence.*;
import com.versioning.engine.service.ResourceService.NewResourceRequest;
import com.versioning.engine.validation.DraftValidator;
import com.versioning.engine.validation.EntityChecks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;

/**
 * Fully wired engine over the in-memory stores, for coordinator tests.
 */
public class InMemoryStack {

    public static final Instant START = Instant.parse("2024-03-01T09:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TimeController time = TimeController.frozenAt(START);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private final InMemoryGroupDirectory directory = new InMemoryGroupDirectory();
    private final InMemoryResourceLockRepository lockRepository = new InMemoryResourceLockRepository();
    private final InMemorySnapshotRepository snapshotRepository = new InMemorySnapshotRepository();
    private final InMemoryDependencyRuleRepository ruleRepository = new InMemoryDependencyRuleRepository();
    private final InMemoryResourceRepository resourceRepository =
        new InMemoryResourceRepository(lockRepository, ruleRepository);
    private final InMemoryDraftRepository draftRepository = new InMemoryDraftRepository();

    private final EntityChecks checks;
    private final DraftValidator validator;
    private final VersioningMetrics metrics;
    private final DraftCoordinator drafts;
    private final ResourceCoordinator resources;
    private final DraftPromotionService promotion;

    public InMemoryStack() {
        metrics = new VersioningMetrics();
        metrics.bindTo(meterRegistry);

        checks = new EntityChecks(resourceRepository, snapshotRepository, draftRepository, directory);
        validator = new DraftValidator(checks, resourceRepository);
        drafts = new DraftCoordinator(draftRepository, resourceRepository, checks, validator, metrics, time);
        resources = new ResourceCoordinator(
            resourceRepository, snapshotRepository, lockRepository, checks, metrics, time);
        promotion = new DraftPromotionService(draftRepository, resourceRepository, resources, checks, metrics);
    }

    /**
     * Register a live user, a live group and the membership between them.
     */
    public InMemoryStack member(long userId, long groupId) {
        directory.addUser(userId).addGroup(groupId).addMember(userId, groupId);
        return this;
    }

    /**
     * Create a resource with one snapshot, returning that snapshot.
     */
    public ResourceSnapshot resource(ResourceType type, long groupId, long creatorId, Long parentResourceId) {
        return resources.createResource(new NewResourceRequest(
            type, groupId, creatorId, data(type.dbName()), "initial", parentResourceId));
    }

    public ObjectNode data(String name) {
        return objectMapper.createObjectNode().put("name", name);
    }

    public TimeController time() {
        return time;
    }

    public SimpleMeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public InMemoryGroupDirectory directory() {
        return directory;
    }

    public DraftValidator validator() {
        return validator;
    }

    public DraftCoordinator drafts() {
        return drafts;
    }

    public ResourceCoordinator resources() {
        return resources;
    }

    public DraftPromotionService promotion() {
        return promotion;
    }
}
