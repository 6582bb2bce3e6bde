package com.versioning.core.repository;

import com.versioning.core.model.DependencyRule;
import com.versioning.core.model.ResourceType;
import java.util.Set;

/**
 * Read access to the declared legal (parent type, child type) pairs.
 * The table is maintained outside this library.
 */
public interface DependencyRuleRepository {

    /**
     * Check if a resource of the parent type may parent one of the child type.
     */
    boolean isLegal(ResourceType parentType, ResourceType childType);

    /**
     * All declared rules.
     */
    Set<DependencyRule> findAll();
}
