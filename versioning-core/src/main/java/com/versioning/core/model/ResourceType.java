package com.versioning.core.model;

import java.util.Arrays;

/**
 * Kinds of versionable entities.
 * Each type is persisted by its lower-snake-case name.
 */
public enum ResourceType {
    QUEUE("queue"),
    EXPERIMENT("experiment"),
    ENTRY_POINT("entry_point"),
    JOB("job"),
    PLUGIN("plugin"),
    PLUGIN_FILE("plugin_file"),
    PLUGIN_TASK_PARAMETER_TYPE("plugin_task_parameter_type"),
    ML_MODEL("ml_model"),
    ML_MODEL_VERSION("ml_model_version"),
    ARTIFACT("artifact");

    private final String dbName;

    ResourceType(String dbName) {
        this.dbName = dbName;
    }

    /**
     * Name used in storage and error messages.
     */
    public String dbName() {
        return dbName;
    }

    /**
     * Resolve a stored name back to its type.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ResourceType fromDbName(String name) {
        return Arrays.stream(values())
            .filter(t -> t.dbName.equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + name));
    }

    @Override
    public String toString() {
        return dbName;
    }
}
