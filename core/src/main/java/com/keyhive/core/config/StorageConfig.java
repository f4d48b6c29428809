package com.keyhive.core.config;

/**
 * Base for backend configurations; {@link #type} names the backend.
 */
public abstract class StorageConfig {
    public final String type;

    protected StorageConfig(String type) {
        this.type = type;
    }
}
