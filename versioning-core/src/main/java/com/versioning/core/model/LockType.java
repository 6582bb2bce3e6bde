package com.versioning.core.model;

/**
 * Types of append-only resource locks.
 */
public enum LockType {
    /**
     * Soft deletion. A resource with this lock is permanently inert.
     */
    DELETE("delete"),

    /**
     * Freezes the resource: no new snapshots or draft modifications.
     */
    READONLY("readonly");

    private final String dbName;

    LockType(String dbName) {
        this.dbName = dbName;
    }

    public String dbName() {
        return dbName;
    }

    public static LockType fromDbName(String name) {
        for (LockType type : values()) {
            if (type.dbName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown lock type: " + name);
    }
}
