package com.trigger.variable;

import com.trigger.exception.StoreException;
import com.trigger.exception.UndefinedSymbolException;
import com.trigger.exception.ValueDecodeException;
import com.trigger.store.KeyValueStore;
import com.trigger.value.Value;
import com.trigger.value.ValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mediates every variable read and write against the key/value store.
 * <p>
 * Reads are served from a write-through cache when this process was the last writer,
 * otherwise from the store. A write that changes a variable is persisted, cached and then
 * handed to the change queue; the writer blocks until a consumer takes the event, so at
 * most one change is ever outstanding. Once {@link #stopDelivery()} is called, writes are
 * still persisted and cached but their events are dropped.
 * <p>
 * The cache is never invalidated by writes made to the store from elsewhere.
 */
public class VariableManager {

    private static final Logger log = LoggerFactory.getLogger(VariableManager.class);

    /**
     * Namespace prefix of variable keys in the store.
     */
    public static final String KEY_PREFIX = "var~";

    private static final long HANDOFF_CHECK_MILLIS = 100;

    private final KeyValueStore store;
    private final ValueCodec codec;
    private final Map<String, Value> cache = new ConcurrentHashMap<>();
    private final SynchronousQueue<ChangeEvent> updates = new SynchronousQueue<>(true);

    // Serializes compare, persist and cache update so concurrent writers cannot interleave
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile boolean delivering = true;

    public VariableManager(KeyValueStore store) {
        this(store, new ValueCodec());
    }

    public VariableManager(KeyValueStore store, ValueCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Read a variable.
     *
     * @param name Variable name
     * @return Current value
     * @throws UndefinedSymbolException if the variable was never stored
     * @throws ValueDecodeException     if the stored record cannot be decoded
     * @throws StoreException           if the store cannot be read
     */
    public Value get(String name) {
        Value cached = cache.get(name);
        if (cached != null) {
            return cached;
        }

        Optional<String> record = store.get(storageKey(name));
        if (record.isEmpty()) {
            throw new UndefinedSymbolException(name);
        }
        return codec.decode(record.get());
    }

    /**
     * Write a variable. Writing the value it already holds is a no-op.
     * <p>
     * Blocks until the resulting change event has been taken from the queue or delivery
     * has stopped.
     *
     * @param name  Variable name
     * @param value New value
     * @return true if the value changed and an event was published
     * @throws StoreException if the store cannot be written
     * @throws com.trigger.exception.ValueEncodeException if the value cannot be persisted
     */
    public boolean set(String name, Value value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");

        ChangeEvent event;
        writeLock.lock();
        try {
            if (value.equals(current(name))) {
                return false;
            }
            String record = codec.encode(value);
            store.set(storageKey(name), record);
            cache.put(name, value);
            event = new ChangeEvent(name, value);
        } finally {
            writeLock.unlock();
        }

        log.debug("Variable '{}' changed to {}", name, value);
        publish(event);
        return true;
    }

    /**
     * Wait for the next change event.
     *
     * @return The event, handed over by a blocked writer
     * @throws InterruptedException if interrupted while waiting
     */
    public ChangeEvent takeChange() throws InterruptedException {
        return updates.take();
    }

    /**
     * Wait up to a timeout for the next change event.
     *
     * @return The event, or null if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public ChangeEvent pollChange(long timeout, TimeUnit unit) throws InterruptedException {
        return updates.poll(timeout, unit);
    }

    /**
     * Stop handing change events over. Writers blocked on a hand-off return and later
     * writes no longer wait for a consumer.
     */
    public void stopDelivery() {
        delivering = false;
    }

    /**
     * Whether a value for this variable is held in the cache.
     */
    public boolean isCached(String name) {
        return cache.containsKey(name);
    }

    static String storageKey(String name) {
        return KEY_PREFIX + name;
    }

    // Value used for no-op detection: cached, else stored, else null
    private Value current(String name) {
        try {
            return get(name);
        } catch (UndefinedSymbolException e) {
            return null;
        } catch (ValueDecodeException e) {
            log.warn("Overwriting undecodable record of variable '{}': {}", name, e.getMessage());
            return null;
        }
    }

    private void publish(ChangeEvent event) {
        try {
            while (delivering) {
                if (updates.offer(event, HANDOFF_CHECK_MILLIS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
            log.debug("Change of '{}' not delivered, delivery stopped", event.name());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted before change of '{}' was delivered", event.name());
        }
    }
}
