package com.copilot.condition;

import com.copilot.condition.impl.AlwaysTrueCondition;
import com.copilot.condition.impl.AndCondition;
import com.copilot.condition.impl.AttributeCondition;
import com.copilot.condition.impl.ConnectedCondition;
import com.copilot.condition.impl.FeatureCondition;
import com.copilot.condition.impl.NotCondition;
import com.copilot.condition.impl.OrCondition;
import com.copilot.condition.impl.PathExistsCondition;
import com.copilot.exception.ConfigurationException;
import com.copilot.graph.Direction;
import com.copilot.graph.NodeType;
import com.copilot.graph.Relation;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@link ConditionConfig} trees into {@link Condition} instances.
 * Every structural problem is reported here, so a compiled condition never fails
 * for configuration reasons at evaluation time.
 */
public class ConditionFactory {

    /**
     * Create a Condition instance from configuration.
     *
     * @param config Condition configuration
     * @return Compiled condition
     * @throws ConfigurationException if the configuration is malformed
     */
    public Condition create(ConditionConfig config) {
        if (config == null) {
            throw new ConfigurationException("Condition configuration cannot be null");
        }

        ConditionType type = config.type();
        if (type == null) {
            throw new ConfigurationException("Condition type cannot be null");
        }

        return switch (type) {
            case ALWAYS_TRUE -> AlwaysTrueCondition.INSTANCE;
            case FEATURE -> createFeatureCondition(config);
            case CONNECTED -> createConnectedCondition(config);
            case PATH_EXISTS -> createPathExistsCondition(config);
            case ATTRIBUTE -> createAttributeCondition(config);
            case AND -> new AndCondition(createNestedConditions(config));
            case OR -> new OrCondition(createNestedConditions(config));
            case NOT -> createNotCondition(config);
        };
    }

    private Condition createFeatureCondition(ConditionConfig config) {
        validateField(config);
        ComparisonOperator operator = parseOperator(config);
        validateLiteral(config, operator);
        return new FeatureCondition(config.field(), operator, config.value(), config.values());
    }

    private Condition createConnectedCondition(ConditionConfig config) {
        GraphSelector graph = requireGraph(config);
        Relation relation = parseRelation(config, graph.relation());
        NodeType targetType = parseNodeType(config, graph.targetType());
        Direction direction = parseDirection(config, graph.direction());
        return new ConnectedCondition(relation, targetType, direction);
    }

    private Condition createPathExistsCondition(ConditionConfig config) {
        GraphSelector graph = requireGraph(config);
        if (graph.targetId() == null || graph.targetId().isBlank()) {
            throw new ConfigurationException("PATH_EXISTS condition requires a target id");
        }
        if (graph.maxHops() == null || graph.maxHops() < 0) {
            throw new ConfigurationException("PATH_EXISTS condition requires non-negative max hops, got "
                    + graph.maxHops());
        }
        return new PathExistsCondition(graph.targetId(), graph.maxHops());
    }

    private Condition createAttributeCondition(ConditionConfig config) {
        validateField(config);
        GraphSelector graph = requireGraph(config);
        ComparisonOperator operator = parseOperator(config);
        validateLiteral(config, operator);

        NodeSelector selector;
        if (graph.isSubject()) {
            selector = NodeSelector.subject();
        } else if (graph.nodeRef() != null && !graph.nodeRef().isBlank()) {
            throw new ConfigurationException("ATTRIBUTE condition has unknown node reference '"
                    + graph.nodeRef() + "'; use 'subject' or a relation selector");
        } else {
            Relation relation = parseRelation(config, graph.relation());
            Direction direction = parseDirection(config, graph.direction());
            NodeType type = graph.targetType() == null ? null : parseNodeType(config, graph.targetType());
            selector = NodeSelector.neighbors(relation, direction, type);
        }
        return new AttributeCondition(selector, config.field(), operator, config.value(), config.values());
    }

    private Condition createNotCondition(ConditionConfig config) {
        validateConditions(config);
        if (config.conditions().size() != 1) {
            throw new ConfigurationException("NOT condition must have exactly one nested condition");
        }
        return new NotCondition(create(config.conditions().get(0)));
    }

    private List<Condition> createNestedConditions(ConditionConfig config) {
        validateConditions(config);
        List<Condition> conditions = new ArrayList<>();
        for (ConditionConfig cfg : config.conditions()) {
            conditions.add(create(cfg));
        }
        return conditions;
    }

    // Validation helpers

    private void validateField(ConditionConfig config) {
        if (config.field() == null || config.field().isBlank()) {
            throw new ConfigurationException(config.type() + " condition requires a "
                    + (config.type() == ConditionType.FEATURE ? "feature name" : "attribute name"));
        }
    }

    private ComparisonOperator parseOperator(ConditionConfig config) {
        try {
            return ComparisonOperator.parse(config.operator());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(config.type() + " condition on '" + config.field() + "': "
                    + e.getMessage(), e);
        }
    }

    private void validateLiteral(ConditionConfig config, ComparisonOperator operator) {
        if (operator == ComparisonOperator.IN) {
            if (config.values() == null || config.values().isEmpty()) {
                throw new ConfigurationException(config.type() + " condition on '" + config.field()
                        + "' requires a non-empty values list for IN");
            }
            return;
        }
        if (config.value() == null) {
            throw new ConfigurationException(config.type() + " condition on '" + config.field()
                    + "' requires a value");
        }
        if (operator.isOrdering() && !(config.value() instanceof Number)) {
            throw new ConfigurationException(config.type() + " condition on '" + config.field()
                    + "': operator " + operator.symbol() + " requires a numeric value, got '" + config.value() + "'");
        }
    }

    private void validateConditions(ConditionConfig config) {
        if (config.conditions() == null || config.conditions().isEmpty()) {
            throw new ConfigurationException(config.type() + " condition requires nested conditions");
        }
    }

    private GraphSelector requireGraph(ConditionConfig config) {
        if (config.graph() == null) {
            throw new ConfigurationException(config.type() + " condition requires graph references");
        }
        return config.graph();
    }

    private Relation parseRelation(ConditionConfig config, String label) {
        try {
            return Relation.parse(label);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(config.type() + " condition has unknown relation '" + label + "'", e);
        }
    }

    private NodeType parseNodeType(ConditionConfig config, String label) {
        try {
            return NodeType.parse(label);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(config.type() + " condition has unknown node type '" + label + "'", e);
        }
    }

    private Direction parseDirection(ConditionConfig config, String label) {
        try {
            return Direction.parse(label);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(config.type() + " condition has unknown direction '" + label + "'", e);
        }
    }
}
