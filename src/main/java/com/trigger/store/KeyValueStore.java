package com.trigger.store;

import java.util.Optional;

/**
 * Durable key/value store backing persisted variables.
 * Keys are namespaced by their users; values are opaque strings.
 */
public interface KeyValueStore {

    /**
     * Read a key.
     *
     * @param key Storage key
     * @return Stored value, or empty if the key does not exist
     * @throws com.trigger.exception.StoreException if the store cannot be read
     */
    Optional<String> get(String key);

    /**
     * Write a key, replacing any previous value.
     *
     * @param key   Storage key
     * @param value Value to store
     * @throws com.trigger.exception.StoreException if the store cannot be written
     */
    void set(String key, String value);
}
