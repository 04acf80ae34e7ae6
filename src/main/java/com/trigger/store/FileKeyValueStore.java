package com.trigger.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trigger.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Store persisted as a single JSON document mapping keys to values.
 * <p>
 * The whole document is rewritten on every {@link #set}, through a temporary
 * file that is moved over the previous one.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(FileKeyValueStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Map<String, String> entries;

    public FileKeyValueStore(Path path) {
        this(path, new ObjectMapper());
    }

    public FileKeyValueStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.entries = load();
        log.info("Opened variable store {} with {} keys", path, entries.size());
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void set(String key, String value) {
        String previous = entries.put(key, value);
        try {
            flush();
        } catch (IOException e) {
            if (previous == null) {
                entries.remove(key);
            } else {
                entries.put(key, previous);
            }
            throw new StoreException("Failed to write store " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    private Map<String, String> load() {
        if (!Files.exists(path)) {
            return new TreeMap<>();
        }
        try {
            Map<String, String> stored = objectMapper.readValue(path.toFile(),
                    new TypeReference<Map<String, String>>() {});
            return stored == null ? new TreeMap<>() : new TreeMap<>(stored);
        } catch (IOException e) {
            throw new StoreException("Failed to read store " + path, e);
        }
    }

    private void flush() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
