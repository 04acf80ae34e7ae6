package com.trigger.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Volatile store. Contents are lost when the process exits.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();
    private final AtomicInteger readCount = new AtomicInteger();
    private final AtomicInteger writeCount = new AtomicInteger();

    @Override
    public Optional<String> get(String key) {
        readCount.incrementAndGet();
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String key, String value) {
        writeCount.incrementAndGet();
        entries.put(key, value);
    }

    /**
     * Number of {@link #get} calls served so far.
     */
    public int getReadCount() {
        return readCount.get();
    }

    /**
     * Number of {@link #set} calls served so far.
     */
    public int getWriteCount() {
        return writeCount.get();
    }
}
