package com.copilot.config;

import com.copilot.condition.ConditionConfig;
import com.copilot.condition.ConditionType;
import com.copilot.condition.GraphSelector;
import com.copilot.exception.ConfigurationException;
import com.copilot.rule.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads copilot configuration (graph, rules, aggregation and execution settings) from YAML.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ROOT_KEY = "copilot";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static CopilotConfig load(String path) {
        log.info("Loading copilot configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(new Yaml().load(inputStream));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in: " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse configuration from YAML text.
     */
    public static CopilotConfig parse(String yamlText) {
        try {
            return parseYaml(new Yaml().load(new StringReader(yamlText)));
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage(), e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static CopilotConfig parseYaml(Object document) {
        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(document, "configuration root");

        // The copilot section could be at root or under 'copilot' key
        Map<String, Object> copilot = root.containsKey(ROOT_KEY)
                ? asMap(root.get(ROOT_KEY), ROOT_KEY)
                : root;

        String name = getString(copilot, "name", "default-copilot");
        String version = getString(copilot, "version", "1.0");

        AggregationConfig aggregation = parseAggregation(optionalMap(copilot, "aggregation"));
        ExecutionConfig execution = parseExecution(optionalMap(copilot, "execution"));

        Map<String, Object> graphMap = optionalMap(copilot, "graph");
        List<NodeDefinition> nodes = new ArrayList<>();
        List<EdgeDefinition> edges = new ArrayList<>();
        if (graphMap != null) {
            for (Map<String, Object> nodeMap : optionalList(graphMap, "nodes")) {
                nodes.add(parseNode(nodeMap));
            }
            for (Map<String, Object> edgeMap : optionalList(graphMap, "edges")) {
                edges.add(parseEdge(edgeMap));
            }
        }

        List<RuleDefinition> rules = new ArrayList<>();
        for (Map<String, Object> ruleMap : optionalList(copilot, "rules")) {
            rules.add(parseRule(ruleMap, rules.size()));
        }

        CopilotConfig config = new CopilotConfig(name, version, aggregation, execution, nodes, edges, rules);

        log.info("Loaded copilot configuration: {} v{} with {} nodes, {} edges, {} rules",
                name, version, nodes.size(), edges.size(), rules.size());
        return config;
    }

    private static AggregationConfig parseAggregation(Map<String, Object> map) {
        if (map == null) {
            return AggregationConfig.defaults();
        }
        Object topKValue = map.get("top-k");
        int topK = topKValue == null || "unbounded".equalsIgnoreCase(topKValue.toString())
                ? AggregationConfig.UNBOUNDED
                : getInt(map, "top-k", AggregationConfig.UNBOUNDED);
        double minScore = getDouble(map, "min-score", 0.0);

        Set<ExclusionPair> exclusions = new LinkedHashSet<>();
        Object exclusionsValue = map.get("mutual-exclusions");
        if (exclusionsValue != null) {
            if (!(exclusionsValue instanceof List<?> pairs)) {
                throw new ConfigurationException("aggregation.mutual-exclusions must be a list of action id pairs");
            }
            for (Object pair : pairs) {
                if (!(pair instanceof List<?> ids) || ids.size() != 2) {
                    throw new ConfigurationException("Mutual exclusion must list exactly two action ids, got: " + pair);
                }
                exclusions.add(newExclusion(String.valueOf(ids.get(0)), String.valueOf(ids.get(1))));
            }
        }

        try {
            return new AggregationConfig(topK, minScore, exclusions);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid aggregation configuration: " + e.getMessage(), e);
        }
    }

    private static ExclusionPair newExclusion(String first, String second) {
        try {
            return ExclusionPair.of(first, second);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid mutual exclusion: " + e.getMessage(), e);
        }
    }

    private static ExecutionConfig parseExecution(Map<String, Object> map) {
        if (map == null) {
            return ExecutionConfig.defaults();
        }
        int parallelism = getInt(map, "parallelism", Runtime.getRuntime().availableProcessors());
        long timeoutMs = getLong(map, "subject-timeout-ms", 0);
        String prefix = getString(map, "thread-name-prefix", ExecutionConfig.DEFAULT_THREAD_NAME_PREFIX);
        try {
            return new ExecutionConfig(parallelism, timeoutMs, prefix);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid execution configuration: " + e.getMessage(), e);
        }
    }

    private static NodeDefinition parseNode(Map<String, Object> map) {
        String id = requireString(map, "id", "graph node");
        String type = requireString(map, "type", "graph node '" + id + "'");
        Map<String, Object> attributes = optionalMap(map, "attributes");
        return new NodeDefinition(id, type, attributes == null ? Map.of() : new LinkedHashMap<>(attributes));
    }

    private static EdgeDefinition parseEdge(Map<String, Object> map) {
        String source = requireString(map, "source", "graph edge");
        String target = requireString(map, "target", "graph edge from '" + source + "'");
        String relation = requireString(map, "relation", "graph edge " + source + " -> " + target);
        double weight = getDouble(map, "weight", 1.0);
        return new EdgeDefinition(source, target, relation, weight);
    }

    private static RuleDefinition parseRule(Map<String, Object> map, int index) {
        String id = getString(map, "id", null);
        String context = id == null ? "rule #" + index : "rule '" + id + "'";
        int priority = getInt(map, "priority", 0);
        String action = getString(map, "action", null);
        double score = getDouble(map, "score", 1.0);
        String explanation = getString(map, "explanation", "");

        String conditionExpr = getString(map, "condition-expr", null);
        if (conditionExpr == null) {
            conditionExpr = getString(map, "conditionExpr", null);
        }
        Map<String, Object> conditionMap = optionalMap(map, "condition");
        ConditionConfig condition = conditionMap == null ? null : parseCondition(conditionMap, context);

        log.debug("Parsed {}: priority={}, action={}, score={}", context, priority, action, score);
        return new RuleDefinition(id, priority, action, score, explanation, condition, conditionExpr);
    }

    /**
     * Parse a condition tree node. Graph references sit next to the type:
     * {@code relation}, {@code target-type}, {@code direction} for CONNECTED;
     * {@code target}, {@code max-hops} for PATH_EXISTS; {@code node} or a relation
     * selector for ATTRIBUTE.
     */
    @SuppressWarnings("unchecked")
    private static ConditionConfig parseCondition(Map<String, Object> map, String context) {
        String typeStr = getString(map, "type", "ALWAYS_TRUE");
        ConditionType type;
        try {
            type = ConditionType.valueOf(typeStr.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown condition type '" + typeStr + "' in " + context, e);
        }

        String field = getString(map, "field", null);
        if (field == null) {
            field = getString(map, "name", null);
        }
        String operator = getString(map, "operator", null);
        Object value = map.get("value");
        List<Object> values = (List<Object>) map.get("values");
        if (operator == null && values != null) {
            operator = "IN";
        }

        GraphSelector graph = null;
        if (type == ConditionType.CONNECTED || type == ConditionType.PATH_EXISTS || type == ConditionType.ATTRIBUTE) {
            Object maxHops = map.get("max-hops");
            graph = new GraphSelector(
                    getString(map, "node", null),
                    getString(map, "relation", null),
                    getString(map, "direction", null),
                    getString(map, "target-type", null),
                    getString(map, "target", null),
                    maxHops == null ? null : getInt(map, "max-hops", 0));
        }

        List<ConditionConfig> nested = null;
        Object conditionsValue = map.get("conditions");
        if (conditionsValue instanceof List<?> list) {
            nested = new ArrayList<>();
            for (Object child : list) {
                nested.add(parseCondition(asMap(child, "condition in " + context), context));
            }
        } else if (map.get("condition") != null) {
            nested = List.of(parseCondition(asMap(map.get("condition"), "condition in " + context), context));
        }

        return new ConditionConfig(type, field, operator, value, values, graph, nested);
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Expected a mapping for " + what + ", got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> optionalMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : asMap(value, key);
    }

    private static List<Map<String, Object>> optionalList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Expected a list for '" + key + "', got: " + value);
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            result.add(asMap(item, "entry of '" + key + "'"));
        }
        return result;
    }

    private static String requireString(Map<String, Object> map, String key, String what) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(what + " requires '" + key + "'");
        }
        return value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        try {
            if (value instanceof Number) return new BigDecimal(value.toString()).intValueExact();
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigurationException("'" + key + "' must be an integer within "
                    + Integer.MIN_VALUE + ".." + Integer.MAX_VALUE + ", got: " + value, e);
        }
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        try {
            if (value instanceof Number) return new BigDecimal(value.toString()).longValueExact();
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got: " + value, e);
        }
    }
}
