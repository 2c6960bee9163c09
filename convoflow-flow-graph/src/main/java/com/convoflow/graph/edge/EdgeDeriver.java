package com.convoflow.graph.edge;

import com.convoflow.graph.decision.DecisionNodeIds;
import com.convoflow.graph.model.EdgeKind;
import com.convoflow.graph.model.GraphEdge;
import com.convoflow.graph.model.GraphNode;
import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.DecisionCondition;
import com.convoflow.schema.model.DocumentEdge;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.FlowNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes edges from function routing. Output order is source node, then function, then
 * condition, then default; the same input always yields an equal list. Callers replace their
 * edge set with the result and never patch it.
 */
public final class EdgeDeriver {

    static final int LABEL_CHAR_WIDTH = 6;
    static final int LABEL_EXTRA_WIDTH = 4;
    static final int LABEL_PADDING = 4;

    public static final String DEFAULT_LABEL = "default";

    private EdgeDeriver() {
    }

    /**
     * Presentation edges for the given nodes. Decision nodes in the input are not sources; each
     * function with a decision routes through its decision node instead.
     */
    public static List<GraphEdge> derive(List<GraphNode> nodes) {
        List<GraphEdge> edges = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (node.isDecision()) continue;
            String nodeId = node.getId();
            int loopIndex = 0;
            double loopOffset = 0;
            for (FlowFunction function : node.getData().getFunctions()) {
                Decision decision = function.getDecision();
                if (decision != null) {
                    String decisionId = DecisionNodeIds.of(nodeId, function.getName());
                    edges.add(GraphEdge.of("e-" + nodeId + "-" + function.getName() + "-decision",
                            nodeId, decisionId, null, EdgeKind.DECISION_ENTRY));
                    List<DecisionCondition> conditions = decision.getConditions();
                    for (int i = 0; i < conditions.size(); i++) {
                        DecisionCondition condition = conditions.get(i);
                        if (isBlank(condition.getNextNodeId())) continue;
                        edges.add(GraphEdge.of("e-" + decisionId + "-c" + i, decisionId, condition.getNextNodeId(),
                                condition.label(), EdgeKind.DECISION_BRANCH));
                    }
                    if (!isBlank(decision.getDefaultNextNodeId())) {
                        edges.add(GraphEdge.of("e-" + decisionId + "-default", decisionId,
                                decision.getDefaultNextNodeId(), DEFAULT_LABEL, EdgeKind.DECISION_BRANCH));
                    }
                    continue;
                }
                String target = function.getNextNodeId();
                if (isBlank(target)) continue;
                String edgeId = "e-" + nodeId + "-" + function.getName();
                if (target.equals(nodeId)) {
                    edges.add(new GraphEdge(edgeId, nodeId, target, function.getName(), EdgeKind.FUNCTION,
                            loopIndex, loopOffset));
                    loopIndex++;
                    loopOffset += labelWidth(function.getName()) + LABEL_PADDING;
                } else {
                    edges.add(GraphEdge.of(edgeId, nodeId, target, function.getName(), EdgeKind.FUNCTION));
                }
            }
        }
        return edges;
    }

    /**
     * Edge cache written into an exported document. Decisions are collapsed into direct edges from
     * the owning node, so the cache never names a decision node.
     */
    public static List<DocumentEdge> deriveDocumentEdges(List<FlowNode> nodes) {
        List<DocumentEdge> edges = new ArrayList<>();
        for (FlowNode node : nodes) {
            String nodeId = node.getId();
            for (FlowFunction function : node.getData().getFunctions()) {
                String base = "e-" + nodeId + "-" + function.getName();
                Decision decision = function.getDecision();
                if (decision == null) {
                    if (!isBlank(function.getNextNodeId())) {
                        edges.add(new DocumentEdge(base, nodeId, function.getNextNodeId(), function.getName()));
                    }
                    continue;
                }
                List<DecisionCondition> conditions = decision.getConditions();
                for (int i = 0; i < conditions.size(); i++) {
                    DecisionCondition condition = conditions.get(i);
                    if (isBlank(condition.getNextNodeId())) continue;
                    edges.add(new DocumentEdge(base + "-c" + i, nodeId, condition.getNextNodeId(), condition.label()));
                }
                if (!isBlank(decision.getDefaultNextNodeId())) {
                    edges.add(new DocumentEdge(base + "-default", nodeId, decision.getDefaultNextNodeId(), DEFAULT_LABEL));
                }
            }
        }
        return edges;
    }

    /** True when both edge lists are the same instance or structurally equal. */
    public static boolean sameEdges(List<GraphEdge> previous, List<GraphEdge> next) {
        return previous == next || (previous != null && previous.equals(next));
    }

    /** Approximate rendered width of an edge label. */
    static double labelWidth(String label) {
        return (label != null ? label.length() : 0) * LABEL_CHAR_WIDTH + LABEL_EXTRA_WIDTH;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
