package com.solfmt.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                          Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }
        return _coerce(pluginConfig.get(key), defaultValue);
    }

    /**
     * Glob patterns of files to skip. Non-string entries are ignored.
     */
    public List<String> getIgnoreFiles() {
        Object value = generalConfig.get("ignoreFiles");
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> patterns = new ArrayList<>();
        for (Object pattern : (List<?>) value) {
            if (pattern instanceof String) {
                patterns.add((String) pattern);
            }
        }
        return patterns;
    }

    /**
     * Converts a raw YAML value to the type of {@code defaultValue}, which is returned when the value
     * is missing or cannot be converted.
     */
    @SuppressWarnings("unchecked")
    private static <T> T _coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }

        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        } else if (defaultValue instanceof Integer && value instanceof String) {
            try {
                return (T) Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }

        return defaultValue;
    }
}
