package com.trigger.config;

/**
 * Backing store implementations.
 */
public enum StoreType {
    /**
     * JSON document on disk, survives restarts.
     */
    FILE,

    /**
     * Process memory only.
     */
    MEMORY
}
