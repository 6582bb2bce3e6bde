package com.versioning.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code versioning} prefix.
 */
@ConfigurationProperties(prefix = "versioning")
public class VersioningProperties {

    /**
     * Storage back end for resources, snapshots, locks and drafts.
     */
    public enum Store {
        JDBC,
        MEMORY
    }

    private Store store = Store.JDBC;

    /**
     * Value of the common "application" metrics tag.
     */
    private String applicationName = "resource-versioning";

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }
}
