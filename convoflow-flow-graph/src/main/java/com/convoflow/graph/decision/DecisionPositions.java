package com.convoflow.graph.decision;

import com.convoflow.graph.model.GraphNode;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.NodeData;
import com.convoflow.schema.model.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves a decision node and records the position on the owning function's decision, the only
 * place where canvas state flows back into the document.
 */
public final class DecisionPositions {

    private DecisionPositions() {
    }

    /**
     * @return a new node list with the decision node moved and its owner's
     *         {@code decision_node_position} updated
     * @throws IllegalArgumentException if the id is not a decision node id or its owner has no such decision
     */
    public static List<GraphNode> writeBack(List<GraphNode> nodes, String decisionNodeId, Position position) {
        DecisionKey key = DecisionNodeIds.parse(decisionNodeId)
                .orElseThrow(() -> new IllegalArgumentException("Not a decision node id: " + decisionNodeId));
        boolean ownerUpdated = false;
        List<GraphNode> result = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes) {
            if (node.isDecision()) {
                result.add(node.getId().equals(decisionNodeId) ? node.withPosition(position) : node);
                continue;
            }
            if (!ownerUpdated && node.getId().equals(key.getSourceNodeId())) {
                GraphNode updated = withDecisionPosition(node, key.getFunctionName(), position);
                if (updated != null) {
                    result.add(updated);
                    ownerUpdated = true;
                    continue;
                }
            }
            result.add(node);
        }
        if (!ownerUpdated) {
            throw new IllegalArgumentException("No decision for " + key + " behind node " + decisionNodeId);
        }
        return result;
    }

    private static GraphNode withDecisionPosition(GraphNode owner, String functionName, Position position) {
        NodeData data = owner.getData();
        List<FlowFunction> functions = data.getFunctions();
        for (int i = 0; i < functions.size(); i++) {
            FlowFunction function = functions.get(i);
            if (function.getName().equals(functionName) && function.getDecision() != null) {
                FlowFunction moved = function.withDecision(function.getDecision().withDecisionNodePosition(position));
                return owner.withData(data.withFunction(i, moved));
            }
        }
        return null;
    }
}
