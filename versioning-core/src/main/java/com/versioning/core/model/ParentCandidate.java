package com.versioning.core.model;

/**
 * Result of looking up a prospective parent resource for a given child type:
 * its deletion state, its type and whether the type pair is a declared rule.
 */
public record ParentCandidate(
    long resourceId,
    ResourceType resourceType,
    boolean deleted,
    boolean legalParent
) {}
