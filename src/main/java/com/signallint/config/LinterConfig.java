package com.signallint.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the linter: general settings, analysis settings and per-rule sections.
 */
public class LinterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Object> analysisConfig;
    private final Map<String, Map<String, Object>> ruleConfigs;

    public LinterConfig(Map<String, Object> generalConfig,
                        Map<String, Object> analysisConfig,
                        Map<String, Map<String, Object>> ruleConfigs) {
        this.generalConfig = generalConfig;
        this.analysisConfig = analysisConfig;
        this.ruleConfigs = ruleConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the analysis config map.
     */
    public Map<String, Object> getAnalysisConfigMap() {
        return new HashMap<>(analysisConfig);
    }

    /**
     * Gets a copy of the rule sections.
     */
    public Map<String, Map<String, Object>> getRuleConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : ruleConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getAnalysisConfig(String key, T defaultValue) {
        return _coerce(analysisConfig.get(key), defaultValue);
    }

    public <T> T getRuleConfig(String ruleId, String key, T defaultValue) {
        Map<String, Object> ruleConfig = ruleConfigs.get(ruleId);
        if (ruleConfig == null) {
            return defaultValue;
        }
        return _coerce(ruleConfig.get(key), defaultValue);
    }

    /**
     * A list-valued setting from a section map; scalars become one-element lists.
     */
    public static List<String> stringList(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else {
            result.add(value.toString());
        }
        return result;
    }

    public List<String> getGeneralList(String key) {
        return stringList(generalConfig.get(key));
    }

    public List<String> getAnalysisList(String key) {
        return stringList(analysisConfig.get(key));
    }

    @SuppressWarnings("unchecked")
    private static <T> T _coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
                if (defaultValue instanceof Integer && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                } else if (defaultValue instanceof Long && value instanceof Number) {
                    return (T) Long.valueOf(((Number) value).longValue());
                } else if (defaultValue instanceof Boolean && value instanceof String) {
                    return (T) Boolean.valueOf(value.toString());
                } else if (defaultValue instanceof String) {
                    return (T) value.toString();
                }
                return defaultValue;
            }
            return (T) value;
        } catch (ClassCastException e) {
            return defaultValue;
        }
    }
}
