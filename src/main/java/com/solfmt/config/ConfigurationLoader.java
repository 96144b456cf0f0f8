package com.solfmt.config;

import com.solfmt.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the YAML configuration, filling in defaults and dropping out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String CONFIG_FILE_NAME = ".solfmt.yml";
    public static final String SOLIDITY_PLUGIN = "solidity";

    public static final int DEFAULT_LINE_LENGTH = 80;
    public static final int DEFAULT_TAB_WIDTH = 4;

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file, falling back to the defaults when it is missing or unreadable.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.fine("Configuration loaded with " +
                    formatterConfig.getPluginConfigsMap().size() + " plugin configurations");

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Looks for {@value #CONFIG_FILE_NAME} in {@code directory} and its parents.
     */
    public static Optional<Path> findConfig(Path directory) {
        for (Path dir = directory.toAbsolutePath(); dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(CONFIG_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Loads the embedded default configuration. The result is cached.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        if (config.get("plugins") instanceof Map) {
            Map<String, Object> pluginsMap = (Map<String, Object>) config.get("plugins");

            for (Map.Entry<String, Object> entry : pluginsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    pluginConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for plugin '" + entry.getKey() + "', using defaults");
                    pluginConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else if (config.containsKey("plugins")) {
            logger.warning("Invalid 'plugins' section in config, using defaults");
        }

        // Range checks run first so that a dropped value is refilled with its default.
        _validateConfigurationValues(generalConfig, pluginConfigs);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(generalConfig, "tabWidth", 1, 8);
        _validateIntRange(generalConfig, "lineLength", 20, 400);

        if (pluginConfigs.containsKey(SOLIDITY_PLUGIN)) {
            Map<String, Object> solidityConfig = pluginConfigs.get(SOLIDITY_PLUGIN);
            _validateIntRange(solidityConfig, "tabWidth", 1, 8);
            _validateIntRange(solidityConfig, "lineLength", 20, 400);
        }
    }

    /**
     * Removes an integer value outside [min, max], or one that is not a number at all.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (!config.containsKey(key)) {
            return;
        }
        Object raw = config.get(key);
        if (!(raw instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number: " + raw + ". Using default value.");
            config.remove(key);
            return;
        }
        int value = ((Number) raw).intValue();
        if (value < min || value > max) {
            logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                    "(" + min + "-" + max + "). Using default value.");
            config.remove(key);
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("tabWidth") instanceof Number)) {
            generalConfig.put("tabWidth", DEFAULT_TAB_WIDTH);
        }
        if (!(generalConfig.get("lineLength") instanceof Number)) {
            generalConfig.put("lineLength", DEFAULT_LINE_LENGTH);
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> solidityConfig = pluginConfigs.computeIfAbsent(SOLIDITY_PLUGIN, k -> new HashMap<>());
        if (!(solidityConfig.get("bracketSpacing") instanceof Boolean)) {
            solidityConfig.put("bracketSpacing", false);
        }
    }

    /**
     * Saves configuration to a file as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            configMap.put("plugins", new TreeMap<>(config.getPluginConfigsMap()));

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
