package com.versioning.core.model;

/**
 * A recorded parent/child link between two concrete resources.
 */
public record DependencyEdge(
    long parentResourceId,
    ResourceType parentType,
    long childResourceId,
    ResourceType childType
) {
    public DependencyRule rule() {
        return new DependencyRule(parentType, childType);
    }
}
