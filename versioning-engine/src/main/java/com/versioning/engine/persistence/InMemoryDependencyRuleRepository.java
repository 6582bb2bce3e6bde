package com.versioning.engine.persistence;

import com.versioning.core.model.DependencyRule;
import com.versioning.core.model.ResourceType;
import com.versioning.core.repository.DependencyRuleRepository;

import java.util.Set;

/**
 * Fixed rule table held in memory.
 */
public class InMemoryDependencyRuleRepository implements DependencyRuleRepository {

    private final Set<DependencyRule> rules;

    public InMemoryDependencyRuleRepository() {
        this(DependencyRule.DEFAULTS);
    }

    public InMemoryDependencyRuleRepository(Set<DependencyRule> rules) {
        this.rules = Set.copyOf(rules);
    }

    @Override
    public boolean isLegal(ResourceType parentType, ResourceType childType) {
        return rules.contains(new DependencyRule(parentType, childType));
    }

    @Override
    public Set<DependencyRule> findAll() {
        return rules;
    }
}
