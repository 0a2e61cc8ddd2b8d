package com.mergeql.core.config;

/**
 * Connection settings of one store. Subclassed per store type.
 */
public abstract class StoreConfig {
    public final String type;

    protected StoreConfig(String type) {
        this.type = type;
    }
}
