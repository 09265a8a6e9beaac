package com.taskpool.config;

import com.taskpool.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads pool configuration from YAML files.
 * <p>
 * Keys are read under a top-level {@code pool} section, or from the document root
 * when that section is absent:
 * <pre>
 * pool:
 *   name: align-pool
 *   thread-count: 8
 *   thread-name-prefix: align-worker-
 *   daemon: false
 * </pre>
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
    public static PoolConfig load(String path) {
        log.info("Loading pool configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from an already opened stream.
     */
    @SuppressWarnings("unchecked")
    public static PoolConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Configuration is not valid YAML", e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        Object section = root.getOrDefault("pool", root);
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'pool' section must be a mapping");
        }
        Map<String, Object> poolConfig = (Map<String, Object>) section;

        PoolConfig defaults = PoolConfig.defaults();
        String name = getString(poolConfig, "name", defaults.name());
        int threadCount = getInt(poolConfig, "thread-count", defaults.threadCount());
        String threadNamePrefix = getString(poolConfig, "thread-name-prefix", name + "-worker-");
        boolean daemon = getBoolean(poolConfig, "daemon", defaults.daemon());

        if (threadCount <= 0) {
            throw new ConfigurationException("thread-count must be positive, got " + threadCount);
        }
        if (threadNamePrefix.isBlank()) {
            throw new ConfigurationException("thread-name-prefix cannot be blank");
        }

        PoolConfig config = new PoolConfig(name, threadCount, threadNamePrefix, daemon);
        log.info("Loaded pool configuration: {} with {} threads (prefix='{}', daemon={})",
                name, threadCount, threadNamePrefix, daemon);
        return config;
    }

    private static Resource getResource(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Configuration path cannot be empty");
        }
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
