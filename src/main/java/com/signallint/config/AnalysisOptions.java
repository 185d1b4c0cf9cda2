package com.signallint.config;

import com.signallint.api.error.Severity;
import com.signallint.plugins.react.traversal.NodeBudget;
import com.signallint.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable, validated view of the analysis and rule settings. Safe to share between runs.
 * Recoverable problems (bad patterns, unknown severities) are logged once, here, and replaced by safe values.
 */
public final class AnalysisOptions {
    private static final Logger logger = LoggerUtil.getLogger(AnalysisOptions.class);

    public static final String DEFAULT_SUFFIX = "Signal";
    public static final String DEFAULT_HOOK_PATTERN = "^use[A-Z]";
    public static final List<String> DEFAULT_CREATOR_NAMES = List.of("signal", "computed", "effect");
    public static final List<String> DEFAULT_HOOK_CREATOR_NAMES = List.of("useSignal", "useComputed");
    public static final List<String> DEFAULT_MODULES =
            List.of("@preact/signals-react", "@preact/signals-core", "@preact/signals");
    public static final List<String> DEFAULT_EFFECT_CALLEES = List.of("useEffect", "useLayoutEffect");

    public static final int DEFAULT_MAX_NODES = 200_000;
    public static final int DEFAULT_MAX_TIME_MS = 10_000;
    public static final int DEFAULT_MAX_MEMORY_MB = 512;

    /** Pattern used in place of an invalid one. */
    static final Pattern MATCH_NOTHING = Pattern.compile("(?!)");

    private final String suffix;
    private final Pattern suffixPattern;
    private final Set<String> creatorNames;
    private final Set<String> hookCreatorNames;
    private final boolean allowBareNames;
    private final boolean enableSuffixHeuristic;
    private final Set<String> modules;
    private final Set<String> effectCallees;
    private final Pattern hookPattern;
    private final List<Pattern> allowedPatterns;
    private final int maxNodes;
    private final int maxTimeMillis;
    private final int maxMemoryMb;
    private final Map<String, Severity> ruleSeverities;
    private final Map<String, Map<String, Severity>> kindSeverities;
    private final Map<String, Map<String, Object>> ruleOptions;

    private AnalysisOptions(LinterConfig config) {
        String configuredSuffix = config.getAnalysisConfig("suffix", DEFAULT_SUFFIX);
        this.suffix = configuredSuffix.isEmpty() ? DEFAULT_SUFFIX : configuredSuffix;
        this.suffixPattern = Pattern.compile(Pattern.quote(suffix) + "$");
        this.creatorNames = _nameSet(config.getAnalysisList("creatorNames"), DEFAULT_CREATOR_NAMES, false);
        this.hookCreatorNames = _nameSet(config.getAnalysisList("hookCreatorNames"), DEFAULT_HOOK_CREATOR_NAMES, false);
        this.allowBareNames = config.getAnalysisConfig("allowBareNames", true);
        this.enableSuffixHeuristic = config.getAnalysisConfig("enableSuffixHeuristic", true);
        this.modules = _nameSet(config.getAnalysisList("modules"), DEFAULT_MODULES, true);
        this.effectCallees = _nameSet(config.getAnalysisList("effectCallees"), DEFAULT_EFFECT_CALLEES, true);
        this.hookPattern = _compile("hookPattern", config.getAnalysisConfig("hookPattern", DEFAULT_HOOK_PATTERN));

        List<Pattern> allowed = new ArrayList<>();
        for (String regex : config.getAnalysisList("allowedPatterns")) {
            allowed.add(_compile("allowedPatterns", regex));
        }
        this.allowedPatterns = Collections.unmodifiableList(allowed);

        Map<String, Object> budget = _budgetSection(config);
        this.maxNodes = _intValue(budget.get("maxNodes"), DEFAULT_MAX_NODES);
        this.maxTimeMillis = _intValue(budget.get("maxTime"), DEFAULT_MAX_TIME_MS);
        this.maxMemoryMb = _intValue(budget.get("maxMemory"), DEFAULT_MAX_MEMORY_MB);

        this.ruleSeverities = new HashMap<>();
        this.kindSeverities = new HashMap<>();
        this.ruleOptions = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> rule : config.getRuleConfigsMap().entrySet()) {
            _readRule(rule.getKey(), rule.getValue());
        }
    }

    public static AnalysisOptions from(LinterConfig config) {
        return new AnalysisOptions(config);
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(ConfigurationLoader.fromMap(new HashMap<>()));
    }

    private void _readRule(String ruleId, Map<String, Object> section) {
        Object severity = section.get("severity");
        if (severity instanceof Map) {
            Map<String, Severity> perKind = new HashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) severity).entrySet()) {
                Severity parsed = _parseSeverity(ruleId + "." + entry.getKey(), entry.getValue());
                if (parsed != null) {
                    perKind.put(String.valueOf(entry.getKey()), parsed);
                }
            }
            kindSeverities.put(ruleId, Collections.unmodifiableMap(perKind));
        } else if (severity != null) {
            Severity parsed = _parseSeverity(ruleId, severity);
            if (parsed != null) {
                ruleSeverities.put(ruleId, parsed);
            }
        }

        Map<String, Object> options = new HashMap<>(section);
        options.remove("severity");
        ruleOptions.put(ruleId, Collections.unmodifiableMap(options));
    }

    private static Severity _parseSeverity(String where, Object value) {
        Severity parsed = Severity.fromConfig(value != null ? value.toString() : null);
        if (parsed == null) {
            logger.warning("Unknown severity '" + value + "' for " + where + ", using the default");
        }
        return parsed;
    }

    private static Pattern _compile(String key, String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid regular expression in '" + key + "': " + e.getDescription()
                    + ". It will match nothing.");
            return MATCH_NOTHING;
        }
    }

    private static Set<String> _nameSet(List<String> configured, List<String> defaults, boolean additive) {
        Set<String> names = new LinkedHashSet<>();
        if (additive || configured.isEmpty()) {
            names.addAll(defaults);
        }
        for (String name : configured) {
            if (!name.isBlank()) {
                names.add(name.trim());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> _budgetSection(LinterConfig config) {
        Object budget = config.getAnalysisConfigMap().get("budget");
        return budget instanceof Map ? (Map<String, Object>) budget : Collections.emptyMap();
    }

    private static int _intValue(Object value, int defaultValue) {
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    /**
     * Severity of a finding kind: a per-kind setting wins over a rule-wide one, which wins over the default.
     */
    public Severity severityFor(String ruleId, String kind, Severity defaultSeverity) {
        Map<String, Severity> perKind = kindSeverities.get(ruleId);
        if (perKind != null && perKind.containsKey(kind)) {
            return perKind.get(kind);
        }
        return ruleSeverities.getOrDefault(ruleId, defaultSeverity);
    }

    public boolean ruleFlag(String ruleId, String option, boolean defaultValue) {
        Map<String, Object> options = ruleOptions.get(ruleId);
        Object value = options != null ? options.get(option) : null;
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * A list-valued rule option as strings; empty when unset or not a list.
     */
    public List<String> ruleStrings(String ruleId, String option) {
        Map<String, Object> options = ruleOptions.get(ruleId);
        Object value = options != null ? options.get(option) : null;
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> strings = new ArrayList<>();
        for (Object element : (List<?>) value) {
            if (element != null && !element.toString().isBlank()) {
                strings.add(element.toString().trim());
            }
        }
        return strings;
    }

    /**
     * Whether a file is exempt from render-mutation checks.
     */
    public boolean isAllowedFile(String fileName) {
        if (fileName == null) {
            return false;
        }
        String normalized = fileName.replace('\\', '/');
        for (Pattern pattern : allowedPatterns) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasSuffix(String name) {
        return name != null && suffixPattern.matcher(name).find();
    }

    public boolean isHookName(String name) {
        return name != null && hookPattern.matcher(name).find();
    }

    public NodeBudget newBudget() {
        return new NodeBudget(maxNodes, maxTimeMillis, maxMemoryMb);
    }

    // Getters
    public String getSuffix() { return suffix; }
    public Set<String> getCreatorNames() { return creatorNames; }
    public Set<String> getHookCreatorNames() { return hookCreatorNames; }
    public boolean isAllowBareNames() { return allowBareNames; }
    public boolean isEnableSuffixHeuristic() { return enableSuffixHeuristic; }
    public Set<String> getModules() { return modules; }
    public Set<String> getEffectCallees() { return effectCallees; }
    public Pattern getHookPattern() { return hookPattern; }
    public List<Pattern> getAllowedPatterns() { return allowedPatterns; }
    public int getMaxNodes() { return maxNodes; }
    public int getMaxTimeMillis() { return maxTimeMillis; }
    public int getMaxMemoryMb() { return maxMemoryMb; }
}
