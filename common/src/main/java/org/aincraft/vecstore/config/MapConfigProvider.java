package org.aincraft.vecstore.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Flat in-memory configuration, keyed by full dot paths.
 */
public final class MapConfigProvider implements ConfigProvider {
    private final Map<String, Object> values;

    public MapConfigProvider() {
        this(Map.of());
    }

    public MapConfigProvider(Map<String, ?> values) {
        this.values = new HashMap<>(values);
    }

    public MapConfigProvider with(String path, Object value) {
        values.put(path, value);
        return this;
    }

    @Override
    public String getString(String path, String defaultValue) {
        Object value = values.get(path);
        return value != null ? value.toString() : defaultValue;
    }

    @Override
    public int getInt(String path, int defaultValue) {
        Object value = values.get(path);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @Override
    public boolean getBoolean(String path, boolean defaultValue) {
        Object value = values.get(path);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }
}
