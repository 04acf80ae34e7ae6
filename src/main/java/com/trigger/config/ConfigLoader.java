package com.trigger.config;

import com.trigger.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;

/**
 * Loads engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static EngineConfig load(String path) {
        log.info("Loading engine configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static EngineConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The engine section may sit at the root or under a 'trigger' key
        Map<String, Object> engine = root.containsKey("trigger")
                ? section(root, "trigger")
                : root;

        String name = getString(engine, "name", "default");
        RulesConfig rules = parseRules(section(engine, "rules"));
        StoreConfig store = parseStore(section(engine, "store"));
        ClockConfig clock = parseClock(section(engine, "clock"));
        DispatchConfig dispatch = parseDispatch(section(engine, "dispatch"));

        EngineConfig config = new EngineConfig(name, rules, store, clock, dispatch);

        log.info("Loaded engine configuration: {} with rules from {} (*{}), {} store, clock {}, batch limit {}",
                name, rules.directory(), rules.suffix(), store.type(),
                clock.enabled() ? clock.intervalMillis() + "ms" : "off",
                dispatch.isBounded() ? dispatch.maxInFlightBatches() : "none");

        return config;
    }

    private static RulesConfig parseRules(Map<String, Object> map) {
        String directory = getString(map, "directory", RulesConfig.DEFAULT_DIRECTORY);
        String suffix = getString(map, "suffix", RulesConfig.DEFAULT_SUFFIX);
        if (suffix.isBlank()) {
            throw new ConfigurationException("rules.suffix must not be blank");
        }
        return new RulesConfig(directory, suffix);
    }

    private static StoreConfig parseStore(Map<String, Object> map) {
        String typeName = getString(map, "type", StoreType.MEMORY.name());
        StoreType type;
        try {
            type = StoreType.valueOf(typeName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown store.type '" + typeName + "'. Expected file or memory.");
        }

        String path = getString(map, "path", null);
        if (type == StoreType.FILE && (path == null || path.isBlank())) {
            throw new ConfigurationException("store.path is required for a file store");
        }
        return new StoreConfig(type, path);
    }

    private static ClockConfig parseClock(Map<String, Object> map) {
        boolean enabled = getBoolean(map, "enabled", true);
        long interval = getLong(map, "interval-millis", 1000);
        if (interval <= 0) {
            throw new ConfigurationException("clock.interval-millis must be positive, got " + interval);
        }
        return new ClockConfig(enabled, interval);
    }

    private static DispatchConfig parseDispatch(Map<String, Object> map) {
        int limit = getInt(map, "max-in-flight-batches", 0);
        if (limit < 0) {
            throw new ConfigurationException("dispatch.max-in-flight-batches must not be negative, got " + limit);
        }
        return new DispatchConfig(limit);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'");
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'");
        }
    }
}
