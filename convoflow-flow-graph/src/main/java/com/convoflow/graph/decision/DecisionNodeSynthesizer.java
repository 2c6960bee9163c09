package com.convoflow.graph.decision;

import com.convoflow.config.EditorConfig;
import com.convoflow.graph.model.GraphNode;
import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.Position;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps one decision node per function that has a decision.
 * <p>
 * Missing decision nodes are created (at {@code decision_node_position} when set, otherwise offset
 * from the owning node), stale projections are refreshed in place keeping the node's position,
 * and decision nodes whose function no longer has a decision are removed.
 */
public final class DecisionNodeSynthesizer {

    private final EditorConfig config;

    public DecisionNodeSynthesizer() {
        this(EditorConfig.defaults());
    }

    public DecisionNodeSynthesizer(EditorConfig config) {
        this.config = config;
    }

    /**
     * Reconciles decision nodes with the decisions of the regular nodes.
     *
     * @return the input list itself when nothing changes, otherwise a new list with regular
     *         nodes in their original order and new decision nodes appended
     */
    public List<GraphNode> reconcile(List<GraphNode> nodes) {
        Map<String, Wanted> wanted = collectWanted(nodes);

        boolean changed = false;
        Set<String> present = new HashSet<>();
        List<GraphNode> result = new ArrayList<>(nodes.size() + wanted.size());
        for (GraphNode node : nodes) {
            if (!node.isDecision()) {
                result.add(node);
                continue;
            }
            Wanted w = wanted.get(node.getId());
            if (w == null || !present.add(node.getId())) {
                changed = true;
                continue;
            }
            if (!w.projection.equals(node.getProjection())) {
                result.add(node.withProjection(w.projection));
                changed = true;
            } else {
                result.add(node);
            }
        }
        for (Map.Entry<String, Wanted> e : wanted.entrySet()) {
            if (present.contains(e.getKey())) continue;
            result.add(GraphNode.decision(e.getKey(), e.getValue().position, e.getValue().projection));
            changed = true;
        }
        return changed ? result : nodes;
    }

    /** Where a new decision node goes when its decision has no stored position. */
    public Position defaultPosition(Position owner, int ordinal) {
        return owner.offset(config.getDecisionOffsetX(),
                config.getDecisionOffsetY() + ordinal * config.getDecisionStackY());
    }

    private Map<String, Wanted> collectWanted(List<GraphNode> nodes) {
        Map<String, Wanted> wanted = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            if (node.isDecision()) continue;
            int ordinal = 0;
            for (FlowFunction function : node.getData().getFunctions()) {
                Decision decision = function.getDecision();
                if (decision == null) continue;
                String id = DecisionNodeIds.of(node.getId(), function.getName());
                Position position = decision.getDecisionNodePosition() != null
                        ? decision.getDecisionNodePosition()
                        : defaultPosition(node.getPosition(), ordinal);
                wanted.putIfAbsent(id, new Wanted(DecisionProjection.of(node.getId(), function), position));
                ordinal++;
            }
        }
        return wanted;
    }

    private static final class Wanted {
        final DecisionProjection projection;
        final Position position;

        Wanted(DecisionProjection projection, Position position) {
            this.projection = projection;
            this.position = position;
        }
    }
}
