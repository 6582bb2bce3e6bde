package com.versioning.core.model;

import java.util.Set;

/**
 * A declared legal (parent type, child type) pair.
 * Concrete parent/child links between resources must match one of these.
 */
public record DependencyRule(
    ResourceType parentType,
    ResourceType childType
) {
    /**
     * Rules shipped with the platform.
     * Jobs attach to entry points, not directly to experiments.
     */
    public static final Set<DependencyRule> DEFAULTS = Set.of(
        new DependencyRule(ResourceType.EXPERIMENT, ResourceType.ENTRY_POINT),
        new DependencyRule(ResourceType.ENTRY_POINT, ResourceType.QUEUE),
        new DependencyRule(ResourceType.ENTRY_POINT, ResourceType.PLUGIN),
        new DependencyRule(ResourceType.ENTRY_POINT, ResourceType.JOB),
        new DependencyRule(ResourceType.PLUGIN, ResourceType.PLUGIN_FILE),
        new DependencyRule(ResourceType.PLUGIN_FILE, ResourceType.PLUGIN_TASK_PARAMETER_TYPE),
        new DependencyRule(ResourceType.JOB, ResourceType.ARTIFACT),
        new DependencyRule(ResourceType.ML_MODEL, ResourceType.ML_MODEL_VERSION)
    );

    public DependencyRule {
        if (parentType == null || childType == null) {
            throw new IllegalArgumentException("Dependency rule types are required");
        }
    }
}
