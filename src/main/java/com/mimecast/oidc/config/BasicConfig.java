package com.mimecast.oidc.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Map backed configuration container.
 *
 * <p>Provides typed accessors with defaults over a configuration map.
 * <br>Keys may use dot notation to reach into nested maps, for example <i>retry.maxRetries</i>.
 *
 * <p>Numbers read from JSON5 files arrive as doubles and are narrowed by the accessors.
 */
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new BasicConfig instance.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Reads a JSON5 file into a configuration map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws IOException Unable to read file.
     */
    protected static Map<String, Object> readMap(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Object> map = new Gson().fromJson(reader, new TypeToken<Map<String, Object>>() {}.getType());
            return map != null ? map : new HashMap<>();
        }
    }

    /**
     * Checks if property exists.
     *
     * @param key Property key.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        return getProperty(key) != null;
    }

    /**
     * Gets String property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        Object value = getProperty(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets Long property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String key, Long defaultValue) {
        Object value = getProperty(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets Boolean property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        Object value = getProperty(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets Map property.
     *
     * @param key Property key.
     * @return Map of String, Object or empty map if missing.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMapProperty(String key) {
        Object value = getProperty(key);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    /**
     * Gets the underlying map.
     *
     * @return Unmodifiable map.
     */
    public Map<String, Object> getMap() {
        return Collections.unmodifiableMap(map);
    }

    /**
     * Resolves a possibly dotted key.
     *
     * @param key Property key.
     * @return Object or null.
     */
    private Object getProperty(String key) {
        if (map.containsKey(key)) {
            return map.get(key);
        }

        Object current = map;
        for (String part : key.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }
}
