package com.mimecast.wren.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Wraps a JSON5 document parsed into a map and provides type safe accessors with defaults.
 * <br>JSON5 is read with a lenient Gson reader, so comments, unquoted keys and single quotes are accepted.
 * <br>Numbers come back from Gson as doubles and are narrowed by the accessors.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration file path.
     *
     * @param path Path to JSON5 file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        this.map = load(Paths.get(path));
    }

    /**
     * Parses a JSON5 file.
     *
     * @param path File path.
     * @return Map instance, empty for an empty document.
     * @throws IOException Unable to read or parse file.
     */
    public static Map<String, Object> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);

            Map<String, Object> parsed = new Gson().fromJson(jsonReader, MAP_TYPE);
            return parsed != null ? parsed : new HashMap<>();
        } catch (RuntimeException e) {
            throw new IOException("Unable to parse " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets underlying map.
     *
     * @return Map instance.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets string property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets long property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
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
     * Gets map property.
     *
     * @param name Property name.
     * @return Map instance, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }
}
