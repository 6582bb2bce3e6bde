package com.versioning.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Micrometer counters for draft and resource history activity.
 *
 * Metrics exposed:
 * - Drafts created, updated and deleted by kind and resource type
 * - Rejected operations by error code
 * - Resources created, snapshots committed, locks added
 */
public class VersioningMetrics implements MeterBinder {

    public static final String DRAFTS_CREATED = "versioning.drafts.created";
    public static final String DRAFTS_UPDATED = "versioning.drafts.updated";
    public static final String DRAFTS_DELETED = "versioning.drafts.deleted";
    public static final String DRAFTS_PROMOTED = "versioning.drafts.promoted";
    public static final String REJECTIONS = "versioning.rejections";

    public static final String RESOURCES_CREATED = "versioning.resources.created";
    public static final String SNAPSHOTS_COMMITTED = "versioning.snapshots.committed";
    public static final String LOCKS_ADDED = "versioning.locks.added";

    private MeterRegistry registry;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    // ========== Draft Metrics ==========

    public void draftCreated(String draftType, String resourceType) {
        Counter.builder(DRAFTS_CREATED)
            .tag("draft_type", draftType)
            .tag("resource_type", resourceType)
            .description("Total drafts created")
            .register(registry)
            .increment();
    }

    public void draftUpdated(String draftType, boolean repinned) {
        Counter.builder(DRAFTS_UPDATED)
            .tag("draft_type", draftType)
            .tag("repinned", String.valueOf(repinned))
            .description("Total draft updates")
            .register(registry)
            .increment();
    }

    public void draftDeleted() {
        Counter.builder(DRAFTS_DELETED)
            .description("Total drafts deleted")
            .register(registry)
            .increment();
    }

    public void draftPromoted(String draftType) {
        Counter.builder(DRAFTS_PROMOTED)
            .tag("draft_type", draftType)
            .description("Total drafts committed into resources or snapshots")
            .register(registry)
            .increment();
    }

    /**
     * Record a precondition failure.
     */
    public void rejected(String operation, String errorCode) {
        Counter.builder(REJECTIONS)
            .tag("operation", operation)
            .tag("error_code", errorCode)
            .description("Operations rejected by a failed precondition")
            .register(registry)
            .increment();
    }

    // ========== Resource Metrics ==========

    public void resourceCreated(String resourceType) {
        Counter.builder(RESOURCES_CREATED)
            .tag("resource_type", resourceType)
            .description("Total resources created")
            .register(registry)
            .increment();
    }

    public void snapshotCommitted(String resourceType) {
        Counter.builder(SNAPSHOTS_COMMITTED)
            .tag("resource_type", resourceType)
            .description("Total snapshots committed")
            .register(registry)
            .increment();
    }

    public void lockAdded(String lockType) {
        Counter.builder(LOCKS_ADDED)
            .tag("lock_type", lockType)
            .description("Total resource locks added")
            .register(registry)
            .increment();
    }
}
