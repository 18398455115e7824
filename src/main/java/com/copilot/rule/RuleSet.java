package com.copilot.rule;

import com.copilot.condition.Condition;
import com.copilot.condition.impl.AndCondition;
import com.copilot.condition.impl.NotCondition;
import com.copilot.condition.impl.OrCondition;
import com.copilot.condition.impl.PathExistsCondition;
import com.copilot.exception.RuleValidationException;
import com.copilot.graph.KnowledgeGraph;
import com.copilot.graph.Node;
import com.copilot.graph.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Immutable, ordered collection of rules.
 * <p>
 * Evaluation order: descending priority, then ascending declaration index. The order
 * depends only on the rules themselves, so identical input always iterates identically.
 */
public final class RuleSet implements Iterable<Rule> {

    private static final Logger log = LoggerFactory.getLogger(RuleSet.class);

    static final Comparator<Rule> EVALUATION_ORDER = Comparator
            .comparingInt(Rule::priority).reversed()
            .thenComparingInt(Rule::declarationIndex);

    private final List<Rule> ordered;
    private final Map<String, Rule> byId;

    private RuleSet(List<Rule> ordered, Map<String, Rule> byId) {
        this.ordered = ordered;
        this.byId = byId;
    }

    /**
     * Validate and order rules.
     *
     * @throws RuleValidationException on duplicate rule ids
     */
    public static RuleSet load(List<Rule> rules) {
        Map<String, Rule> byId = new LinkedHashMap<>();
        Set<Integer> declarationIndices = new HashSet<>();
        for (Rule rule : rules) {
            if (byId.putIfAbsent(rule.id(), rule) != null) {
                throw new RuleValidationException(rule.id(), "duplicate rule id");
            }
            if (!declarationIndices.add(rule.declarationIndex())) {
                throw new RuleValidationException(rule.id(), "declaration index "
                        + rule.declarationIndex() + " used by more than one rule");
            }
        }

        List<Rule> ordered = new ArrayList<>(rules);
        ordered.sort(EVALUATION_ORDER);

        log.info("Loaded rule set with {} rules", ordered.size());
        if (log.isDebugEnabled()) {
            for (Rule rule : ordered) {
                log.debug("  {}", rule);
            }
        }
        return new RuleSet(Collections.unmodifiableList(ordered), Collections.unmodifiableMap(byId));
    }

    /**
     * Validate and order rules, also checking their references against the graph:
     * every consequence must name an ACTION_TEMPLATE node and every path target must exist.
     */
    public static RuleSet load(List<Rule> rules, KnowledgeGraph graph) {
        for (Rule rule : rules) {
            Optional<Node> action = graph.node(rule.actionId());
            if (action.isEmpty()) {
                throw new RuleValidationException(rule.id(), "action '" + rule.actionId()
                        + "' is not a node of the knowledge graph");
            }
            if (action.get().type() != NodeType.ACTION_TEMPLATE) {
                throw new RuleValidationException(rule.id(), "action '" + rule.actionId()
                        + "' is a " + action.get().type() + " node, expected " + NodeType.ACTION_TEMPLATE);
            }
            for (String target : pathTargets(rule.condition())) {
                if (!graph.containsNode(target)) {
                    throw new RuleValidationException(rule.id(), "path_exists target '" + target
                            + "' is not a node of the knowledge graph");
                }
            }
        }
        return load(rules);
    }

    /**
     * Convenience: compile definitions and load them against the graph.
     */
    public static RuleSet fromDefinitions(List<RuleDefinition> definitions, KnowledgeGraph graph) {
        return load(new RuleFactory().create(definitions), graph);
    }

    private static List<String> pathTargets(Condition condition) {
        List<String> targets = new ArrayList<>();
        collectPathTargets(condition, targets);
        return targets;
    }

    private static void collectPathTargets(Condition condition, List<String> targets) {
        if (condition instanceof PathExistsCondition path) {
            targets.add(path.getTargetId());
        } else if (condition instanceof AndCondition and) {
            and.getConditions().forEach(c -> collectPathTargets(c, targets));
        } else if (condition instanceof OrCondition or) {
            or.getConditions().forEach(c -> collectPathTargets(c, targets));
        } else if (condition instanceof NotCondition not) {
            collectPathTargets(not.getCondition(), targets);
        }
    }

    /**
     * Rules in evaluation order. Each call starts a fresh iteration.
     */
    @Override
    public Iterator<Rule> iterator() {
        return ordered.iterator();
    }

    public Stream<Rule> stream() {
        return ordered.stream();
    }

    public List<Rule> asList() {
        return ordered;
    }

    public Optional<Rule> get(String ruleId) {
        return Optional.ofNullable(byId.get(ruleId));
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    @Override
    public String toString() {
        return "RuleSet{" + ordered.stream().map(Rule::id).toList() + '}';
    }
}
