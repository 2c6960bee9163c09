package com.convoflow.schema.validation;

import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.DecisionCondition;
import com.convoflow.schema.model.DocumentEdge;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.FlowNode;
import com.convoflow.schema.model.NodeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Graph checks on a parsed document: unique node ids, exactly one initial node, unique function
 * names per node, and every edge and routing reference naming an existing node.
 * Blank routing targets mean "not connected" and are not reported.
 */
public final class GraphValidator {

    public List<ValidationError> validate(FlowDocument document) {
        List<ValidationError> errors = new ArrayList<>();
        if (document == null) {
            errors.add(ValidationError.graph("Document is null"));
            return errors;
        }

        Set<String> ids = new HashSet<>();
        Set<String> reported = new HashSet<>();
        int initialCount = 0;
        for (FlowNode node : document.getNodes()) {
            if (!ids.add(node.getId()) && reported.add(node.getId())) {
                errors.add(ValidationError.graph("Duplicate node id: " + node.getId()));
            }
            if (node.getId().startsWith(NodeKind.DECISION_ID_PREFIX)) {
                errors.add(ValidationError.graph("Node id uses reserved prefix '" + NodeKind.DECISION_ID_PREFIX + "': " + node.getId()));
            }
            if (node.getType() == NodeKind.INITIAL) initialCount++;
            if (node.getType() == NodeKind.DECISION) {
                errors.add(ValidationError.graph("Decision nodes cannot be stored in a document: " + node.getId()));
            }
        }
        if (initialCount != 1) {
            errors.add(ValidationError.graph("Flow must have exactly one initial node (found " + initialCount + ")"));
        }

        for (DocumentEdge edge : document.getEdges()) {
            if (!ids.contains(edge.getSource())) {
                errors.add(ValidationError.graph("Edge references unknown node: " + edge.getSource()));
            }
            if (!ids.contains(edge.getTarget())) {
                errors.add(ValidationError.graph("Edge references unknown node: " + edge.getTarget()));
            }
        }

        for (FlowNode node : document.getNodes()) {
            Set<String> names = new HashSet<>();
            for (FlowFunction function : node.getData().getFunctions()) {
                if (!names.add(function.getName())) {
                    errors.add(ValidationError.graph("Duplicate function name '" + function.getName()
                            + "' in node '" + node.getId() + "'"));
                }
                for (String target : routingTargets(function)) {
                    if (!ids.contains(target)) {
                        errors.add(ValidationError.graph("Function '" + function.getName() + "' in node '"
                                + node.getId() + "' references unknown node: " + target));
                    }
                }
            }
        }

        Set<String> globalNames = new HashSet<>();
        for (FlowFunction function : document.getGlobalFunctions()) {
            if (!globalNames.add(function.getName())) {
                errors.add(ValidationError.graph("Duplicate global function name: " + function.getName()));
            }
        }
        return errors;
    }

    /**
     * Non-blank routing targets of a function in evaluation order. With a decision present the plain
     * {@code next_node_id} is ignored.
     */
    static Set<String> routingTargets(FlowFunction function) {
        Set<String> targets = new LinkedHashSet<>();
        Decision decision = function.getDecision();
        if (decision != null) {
            for (DecisionCondition condition : decision.getConditions()) {
                addIfSet(targets, condition.getNextNodeId());
            }
            addIfSet(targets, decision.getDefaultNextNodeId());
        } else {
            addIfSet(targets, function.getNextNodeId());
        }
        return targets;
    }

    private static void addIfSet(Set<String> targets, String target) {
        if (target != null && !target.isBlank()) targets.add(target);
    }
}
