package com.trigger.config;

/**
 * Variable store configuration.
 *
 * @param type Store implementation
 * @param path File path, required for {@link StoreType#FILE}
 */
public record StoreConfig(
        StoreType type,
        String path
) {
    public static StoreConfig memory() {
        return new StoreConfig(StoreType.MEMORY, null);
    }

    public static StoreConfig file(String path) {
        return new StoreConfig(StoreType.FILE, path);
    }
}
