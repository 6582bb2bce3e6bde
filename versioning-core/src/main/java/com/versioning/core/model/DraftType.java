package com.versioning.core.model;

/**
 * Draft kinds used to filter searches.
 */
public enum DraftType {
    /**
     * Any draft.
     */
    ANY,

    /**
     * Draft resources only: proposals for entities that do not exist yet.
     */
    RESOURCE,

    /**
     * Draft modifications of existing resources only.
     */
    MODIFICATION;

    /**
     * Check whether a draft falls under this filter.
     */
    public boolean matches(Draft draft) {
        return this == ANY || draft.type() == this;
    }
}
