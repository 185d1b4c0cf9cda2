package com.signallint.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.signallint.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads linter configuration from YAML, validating values and filling in defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    /** Name of the per-project configuration file. */
    public static final String PROJECT_CONFIG_FILE = ".signallint.yml";

    private ConfigurationLoader() {
    }

    /**
     * Loads configuration from a file, falling back to the embedded defaults on any problem.
     */
    public static LinterConfig loadConfig(Path configPath) {
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
                config = new HashMap<>();
            }

            LinterConfig linterConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded with " + linterConfig.getRuleConfigsMap().size() + " rule sections");
            return linterConfig;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the project file from a directory if present, otherwise the defaults.
     */
    public static LinterConfig loadProjectConfig(Path directory) {
        Path candidate = directory.resolve(PROJECT_CONFIG_FILE);
        return Files.isRegularFile(candidate) ? loadConfig(candidate) : loadDefaultConfig();
    }

    /**
     * Loads the embedded default configuration.
     */
    public static LinterConfig loadDefaultConfig() {
        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);
            return _createConfigFromMap(config != null ? config : new HashMap<>());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Builds a configuration from an already parsed map; used by tests and embedders.
     */
    public static LinterConfig fromMap(Map<String, Object> config) {
        return _createConfigFromMap(config);
    }

    @SuppressWarnings("unchecked")
    private static LinterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Object> analysisConfig = new HashMap<>();
        if (config.get("analysis") instanceof Map) {
            analysisConfig = new HashMap<>((Map<String, Object>) config.get("analysis"));
        } else if (config.containsKey("analysis")) {
            logger.warning("Invalid 'analysis' section in config, using defaults");
        }
        _ensureDefaultAnalysisConfig(analysisConfig);

        Map<String, Map<String, Object>> ruleConfigs = new LinkedHashMap<>();
        if (config.get("rules") instanceof Map) {
            Map<String, Object> rulesMap = (Map<String, Object>) config.get("rules");
            for (Map.Entry<String, Object> entry : rulesMap.entrySet()) {
                Object value = entry.getValue();
                if (value instanceof Map) {
                    ruleConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) value));
                } else if (value instanceof String) {
                    Map<String, Object> shorthand = new HashMap<>();
                    shorthand.put("severity", value);
                    ruleConfigs.put(entry.getKey(), shorthand);
                } else {
                    logger.warning("Invalid configuration for rule '" + entry.getKey() + "', using defaults");
                }
            }
        } else if (config.containsKey("rules")) {
            logger.warning("Invalid 'rules' section in config, using defaults");
        }

        _validateConfigurationValues(analysisConfig);

        return new LinterConfig(generalConfig, analysisConfig, ruleConfigs);
    }

    @SuppressWarnings("unchecked")
    private static void _validateConfigurationValues(Map<String, Object> analysisConfig) {
        Object budget = analysisConfig.get("budget");
        if (budget instanceof Map) {
            Map<String, Object> budgetConfig = new HashMap<>((Map<String, Object>) budget);
            _validateIntRange(budgetConfig, "maxNodes", 100, 5_000_000);
            _validateIntRange(budgetConfig, "maxTime", 10, 600_000);
            _validateIntRange(budgetConfig, "maxMemory", 0, 65_536);
            analysisConfig.put("budget", budgetConfig);
        }
    }

    /**
     * Drops an integer value outside [min, max] so that its default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && config.get(key) instanceof Number) {
            long value = ((Number) config.get(key)).longValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        } else if (config.containsKey(key)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
        }
    }

    private static LinterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Object> analysisConfig = new HashMap<>();
        _ensureDefaultAnalysisConfig(analysisConfig);

        return new LinterConfig(generalConfig, analysisConfig, new LinkedHashMap<>());
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
        if (!(generalConfig.get("includeFiles") instanceof List)) {
            generalConfig.put("includeFiles", new ArrayList<String>());
        }
    }

    private static void _ensureDefaultAnalysisConfig(Map<String, Object> analysisConfig) {
        if (!(analysisConfig.get("suffix") instanceof String)) {
            analysisConfig.put("suffix", AnalysisOptions.DEFAULT_SUFFIX);
        }
        if (!(analysisConfig.get("allowBareNames") instanceof Boolean)) {
            analysisConfig.put("allowBareNames", true);
        }
        if (!(analysisConfig.get("enableSuffixHeuristic") instanceof Boolean)) {
            analysisConfig.put("enableSuffixHeuristic", true);
        }
        if (!(analysisConfig.get("hookPattern") instanceof String)) {
            analysisConfig.put("hookPattern", AnalysisOptions.DEFAULT_HOOK_PATTERN);
        }
        if (!(analysisConfig.get("creatorNames") instanceof List)) {
            analysisConfig.put("creatorNames", new ArrayList<>(AnalysisOptions.DEFAULT_CREATOR_NAMES));
        }
        if (!(analysisConfig.get("hookCreatorNames") instanceof List)) {
            analysisConfig.put("hookCreatorNames", new ArrayList<>(AnalysisOptions.DEFAULT_HOOK_CREATOR_NAMES));
        }
        if (!(analysisConfig.get("budget") instanceof Map)) {
            analysisConfig.put("budget", new HashMap<String, Object>());
        }
    }

    /**
     * Writes a configuration as YAML.
     */
    public static void saveConfig(LinterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("analysis", config.getAnalysisConfigMap());
            configMap.put("rules", config.getRuleConfigsMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
