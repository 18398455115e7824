package com.copilot.report;

import com.copilot.engine.DecisionRecord;
import com.copilot.engine.ScoredAction;
import com.copilot.graph.KnowledgeGraph;
import com.copilot.graph.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Summarizes what executing a decision record involves, using the attributes of the
 * action template nodes: {@code urgency}, {@code budget-required} and {@code requires-approval}.
 * A template without an attribute counts as not requiring it.
 */
public class ActionReportBuilder {

    public static final String URGENCY = "urgency";
    public static final String BUDGET_REQUIRED = "budget-required";
    public static final String REQUIRES_APPROVAL = "requires-approval";

    public static final List<String> TRACKED_URGENCIES = List.of("immediate", "high", "critical");

    private final KnowledgeGraph graph;

    public ActionReportBuilder(KnowledgeGraph graph) {
        this.graph = graph;
    }

    public ActionReport build(DecisionRecord record) {
        Map<String, Integer> urgencyCounts = new LinkedHashMap<>();
        for (String urgency : TRACKED_URGENCIES) {
            urgencyCounts.put(urgency, 0);
        }
        int budget = 0;
        int approvals = 0;
        List<String> actions = new ArrayList<>();

        for (ScoredAction action : record.actions()) {
            actions.add(action.actionId());
            Optional<Node> template = graph.node(action.actionId());
            if (template.isEmpty()) {
                continue;
            }
            Node node = template.get();
            node.attribute(URGENCY)
                    .map(u -> u.toString().toLowerCase(Locale.ROOT))
                    .filter(urgencyCounts::containsKey)
                    .ifPresent(u -> urgencyCounts.merge(u, 1, Integer::sum));
            if (isSet(node, BUDGET_REQUIRED)) {
                budget++;
            }
            if (isSet(node, REQUIRES_APPROVAL)) {
                approvals++;
            }
        }
        return new ActionReport(record.subjectId(), actions.size(), urgencyCounts, budget, approvals, actions);
    }

    private static boolean isSet(Node node, String attribute) {
        return node.attribute(attribute)
                .map(v -> v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString()))
                .orElse(false);
    }
}
