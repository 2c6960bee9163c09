package com.convoflow.graph.edit;

import com.convoflow.graph.decision.DecisionKey;
import com.convoflow.graph.decision.DecisionNodeIds;
import com.convoflow.graph.decision.DecisionPositions;
import com.convoflow.graph.model.GraphNode;
import com.convoflow.graph.model.PresentationGraph;
import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.DecisionCondition;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.NodeData;
import com.convoflow.schema.model.NodeKind;
import com.convoflow.schema.model.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Node and routing mutations of the presentation graph.
 * <p>
 * Every operation returns a new graph whose nodes reflect the edit; decision nodes and edges are
 * left as they were and are brought up to date by the settle step that follows
 * ({@link com.convoflow.graph.adapter.FlowAdapter#settle}). Edits that are not allowed throw
 * {@link IllegalArgumentException} (unknown ids, bad values) or {@link IllegalStateException}
 * (edits that would break the one-initial-node rule).
 */
public final class FlowGraphEdits {

    /** Offset of a duplicated node from its original. */
    static final double DUPLICATE_OFFSET_X = 100;
    static final double DUPLICATE_OFFSET_Y = 20;

    /** Condition index that addresses the default branch of a decision. */
    public static final int DEFAULT_BRANCH = -1;

    private FlowGraphEdits() {
    }

    // ---- nodes

    /**
     * Renames a regular node and rewrites every {@code next_node_id}, condition target and
     * {@code default_next_node_id} equal to the old id. Decision nodes owned by the node are dropped
     * here and recreated under the new id when the graph settles.
     */
    public static PresentationGraph renameNode(PresentationGraph graph, String oldId, String newId) {
        requireRegular(graph, oldId);
        if (newId == null || newId.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be empty");
        }
        if (DecisionNodeIds.isDecisionId(newId)) {
            throw new IllegalArgumentException("Node id cannot start with " + DecisionNodeIds.PREFIX);
        }
        if (oldId.equals(newId)) {
            return graph;
        }
        if (graph.containsNode(newId)) {
            throw new IllegalArgumentException("Node id already exists: " + newId);
        }
        List<GraphNode> result = new ArrayList<>(graph.getNodes().size());
        for (GraphNode node : graph.getNodes()) {
            if (node.isDecision()) {
                if (!node.getProjection().getSourceNodeId().equals(oldId)) result.add(node);
                continue;
            }
            GraphNode renamed = node.getId().equals(oldId) ? node.withId(newId) : node;
            result.add(renamed.withData(retarget(renamed.getData(), oldId, newId)));
        }
        return graph.withNodes(result);
    }

    /** True when the node exists, is not a decision node, is not the sole initial node and is not the last node. */
    public static boolean canDeleteNode(PresentationGraph graph, String id) {
        GraphNode node = graph.findNode(id).orElse(null);
        if (node == null || node.isDecision()) return false;
        List<GraphNode> regular = graph.regularNodes();
        if (regular.size() <= 1) return false;
        if (node.getKind() == NodeKind.INITIAL) {
            long initials = regular.stream().filter(n -> n.getKind() == NodeKind.INITIAL).count();
            return initials > 1;
        }
        return true;
    }

    /**
     * Removes a regular node. References to it elsewhere are left in place and show up as dangling
     * references until the user repoints them.
     */
    public static PresentationGraph deleteNode(PresentationGraph graph, String id) {
        GraphNode node = requireRegular(graph, id);
        if (!canDeleteNode(graph, id)) {
            throw new IllegalStateException(node.getKind() == NodeKind.INITIAL
                    ? "Cannot delete the initial node " + id
                    : "Cannot delete the last node " + id);
        }
        return graph.withNodes(graph.getNodes().stream()
                .filter(n -> !n.getId().equals(id))
                .collect(Collectors.toList()));
    }

    /** Replaces the data of a regular node, e.g. after an inspector edit. */
    public static PresentationGraph updateNodeData(PresentationGraph graph, String id, NodeData data) {
        Objects.requireNonNull(data, "data");
        requireRegular(graph, id);
        return replaceNode(graph, id, n -> n.withData(data));
    }

    /**
     * Appends a new node with an id generated from the label.
     *
     * @throws IllegalStateException when adding a second initial node
     */
    public static PresentationGraph addNode(PresentationGraph graph, NodeKind kind, String label, Position position) {
        if (kind == null || !kind.isDocumentKind()) {
            throw new IllegalArgumentException("Cannot add a node of kind " + kind);
        }
        if (kind == NodeKind.INITIAL && hasInitial(graph)) {
            throw new IllegalStateException("Flow already has an initial node");
        }
        String id = NodeIds.fromLabel(label, nodeIds(graph));
        List<GraphNode> result = new ArrayList<>(graph.getNodes());
        result.add(GraphNode.regular(id, kind, position, NodeData.empty(label)));
        return graph.withNodes(result);
    }

    /**
     * Appends a structural copy of a regular node labelled {@code "<label> copy"} ({@code copy 2}, ...)
     * and offset from the original. Routing references are kept. A copy of the initial node becomes a
     * regular step.
     */
    public static PresentationGraph duplicateNode(PresentationGraph graph, String id) {
        GraphNode original = requireRegular(graph, id);
        List<String> labels = graph.regularNodes().stream()
                .map(n -> n.getData().getLabel())
                .filter(l -> l != null && !l.isBlank())
                .collect(Collectors.toList());
        String label = CopyLabels.next(original.getData().getLabel(), labels);
        String newId = NodeIds.fromLabel(label, nodeIds(graph));
        NodeKind kind = original.getKind() == NodeKind.INITIAL ? NodeKind.STEP : original.getKind();
        GraphNode copy = GraphNode.regular(newId, kind,
                original.getPosition().offset(DUPLICATE_OFFSET_X, DUPLICATE_OFFSET_Y),
                original.getData().copy().withLabel(label));
        List<GraphNode> result = new ArrayList<>(graph.getNodes());
        result.add(copy);
        return graph.withNodes(result);
    }

    /**
     * Drag end. Moving a decision node also stores the position on the owning function's decision.
     */
    public static PresentationGraph moveNode(PresentationGraph graph, String id, Position position) {
        GraphNode node = graph.findNode(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + id));
        if (node.isDecision()) {
            return graph.withNodes(DecisionPositions.writeBack(graph.getNodes(), id, position));
        }
        return replaceNode(graph, id, n -> n.withPosition(position));
    }

    // ---- functions

    public static PresentationGraph addFunction(PresentationGraph graph, String nodeId, FlowFunction function) {
        GraphNode node = requireRegular(graph, nodeId);
        if (node.getData().findFunction(function.getName()) != null) {
            throw new IllegalArgumentException("Function '" + function.getName() + "' already exists in node " + nodeId);
        }
        List<FlowFunction> functions = new ArrayList<>(node.getData().getFunctions());
        functions.add(function);
        return replaceNode(graph, nodeId, n -> n.withData(n.getData().withFunctions(functions)));
    }

    public static PresentationGraph updateFunction(PresentationGraph graph, String nodeId, int index, FlowFunction function) {
        requireFunction(graph, nodeId, index);
        return replaceNode(graph, nodeId, n -> n.withData(n.getData().withFunction(index, function)));
    }

    public static PresentationGraph removeFunction(PresentationGraph graph, String nodeId, int index) {
        GraphNode node = requireRegular(graph, nodeId);
        requireFunction(graph, nodeId, index);
        List<FlowFunction> functions = new ArrayList<>(node.getData().getFunctions());
        functions.remove(index);
        return replaceNode(graph, nodeId, n -> n.withData(n.getData().withFunctions(functions)));
    }

    /**
     * Routes a function to a node: the decision default when the function has a decision, otherwise
     * its {@code next_node_id}.
     */
    public static PresentationGraph connectFunction(PresentationGraph graph, String nodeId, int index, String targetId) {
        requireRegular(graph, targetId);
        FlowFunction function = requireFunction(graph, nodeId, index);
        FlowFunction connected = function.getDecision() != null
                ? function.withDecision(function.getDecision().withDefaultNextNodeId(targetId))
                : function.withNextNodeId(targetId);
        return updateFunction(graph, nodeId, index, connected);
    }

    public static PresentationGraph clearFunctionConnection(PresentationGraph graph, String nodeId, int index) {
        FlowFunction function = requireFunction(graph, nodeId, index);
        FlowFunction cleared = function.getDecision() != null
                ? function.withDecision(function.getDecision().withDefaultNextNodeId(""))
                : function.withNextNodeId(null);
        return updateFunction(graph, nodeId, index, cleared);
    }

    /**
     * Routes a branch of the decision behind {@code decisionNodeId} to a node.
     *
     * @param conditionIndex condition index, or {@link #DEFAULT_BRANCH} for the default
     */
    public static PresentationGraph connectCondition(PresentationGraph graph, String decisionNodeId,
                                                     int conditionIndex, String targetId) {
        requireRegular(graph, targetId);
        DecisionKey key = DecisionNodeIds.parse(decisionNodeId)
                .orElseThrow(() -> new IllegalArgumentException("Not a decision node id: " + decisionNodeId));
        GraphNode owner = requireRegular(graph, key.getSourceNodeId());
        int index = indexOf(owner.getData(), key.getFunctionName());
        FlowFunction function = owner.getData().getFunctions().get(index);
        Decision decision = function.getDecision();
        if (decision == null) {
            throw new IllegalArgumentException("Function '" + key.getFunctionName() + "' has no decision");
        }
        Decision updated;
        if (conditionIndex == DEFAULT_BRANCH) {
            updated = decision.withDefaultNextNodeId(targetId);
        } else if (conditionIndex >= 0 && conditionIndex < decision.getConditions().size()) {
            DecisionCondition condition = decision.getConditions().get(conditionIndex);
            updated = decision.withCondition(conditionIndex, condition.withNextNodeId(targetId));
        } else {
            throw new IllegalArgumentException("No condition " + conditionIndex + " in decision " + decisionNodeId);
        }
        return updateFunction(graph, key.getSourceNodeId(), index, function.withDecision(updated));
    }

    /**
     * Gives a function a decision. The current {@code next_node_id} becomes the default target and stays
     * on the function, where it is ignored while the decision exists. No-op when the function already
     * has a decision.
     */
    public static PresentationGraph addDecision(PresentationGraph graph, String nodeId, int index) {
        FlowFunction function = requireFunction(graph, nodeId, index);
        if (function.getDecision() != null) {
            return graph;
        }
        String defaultTarget = function.getNextNodeId() != null ? function.getNextNodeId() : "";
        FlowFunction withDecision = function.withDecision(Decision.withDefault(defaultTarget));
        return updateFunction(graph, nodeId, index, withDecision);
    }

    /**
     * Removes a function's decision. When the function has no {@code next_node_id} of its own the
     * decision default becomes its {@code next_node_id}.
     */
    public static PresentationGraph removeDecision(PresentationGraph graph, String nodeId, int index) {
        FlowFunction function = requireFunction(graph, nodeId, index);
        Decision decision = function.getDecision();
        if (decision == null) {
            return graph;
        }
        FlowFunction plain = function.withDecision(null);
        boolean hasOwnTarget = function.getNextNodeId() != null && !function.getNextNodeId().isBlank();
        if (!hasOwnTarget && !decision.getDefaultNextNodeId().isBlank()) {
            plain = plain.withNextNodeId(decision.getDefaultNextNodeId());
        }
        return updateFunction(graph, nodeId, index, plain);
    }

    // ---- helpers

    private static NodeData retarget(NodeData data, String oldId, String newId) {
        List<FlowFunction> functions = data.getFunctions();
        List<FlowFunction> updated = new ArrayList<>(functions.size());
        boolean changed = false;
        for (FlowFunction function : functions) {
            FlowFunction f = function;
            if (oldId.equals(f.getNextNodeId())) {
                f = f.withNextNodeId(newId);
            }
            Decision decision = f.getDecision();
            if (decision != null) {
                Decision d = decision;
                for (int i = 0; i < d.getConditions().size(); i++) {
                    DecisionCondition c = d.getConditions().get(i);
                    if (oldId.equals(c.getNextNodeId())) {
                        d = d.withCondition(i, c.withNextNodeId(newId));
                    }
                }
                if (oldId.equals(d.getDefaultNextNodeId())) {
                    d = d.withDefaultNextNodeId(newId);
                }
                if (d != decision) f = f.withDecision(d);
            }
            changed |= f != function;
            updated.add(f);
        }
        return changed ? data.withFunctions(updated) : data;
    }

    private static PresentationGraph replaceNode(PresentationGraph graph, String id, UnaryOperator<GraphNode> change) {
        List<GraphNode> result = new ArrayList<>(graph.getNodes().size());
        for (GraphNode node : graph.getNodes()) {
            result.add(node.getId().equals(id) ? change.apply(node) : node);
        }
        return graph.withNodes(result);
    }

    private static GraphNode requireRegular(PresentationGraph graph, String id) {
        GraphNode node = graph.findNode(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + id));
        if (node.isDecision()) {
            throw new IllegalArgumentException("Decision node " + id + " cannot be edited directly");
        }
        return node;
    }

    private static FlowFunction requireFunction(PresentationGraph graph, String nodeId, int index) {
        List<FlowFunction> functions = requireRegular(graph, nodeId).getData().getFunctions();
        if (index < 0 || index >= functions.size()) {
            throw new IllegalArgumentException("No function " + index + " in node " + nodeId);
        }
        return functions.get(index);
    }

    private static int indexOf(NodeData data, String functionName) {
        List<FlowFunction> functions = data.getFunctions();
        for (int i = 0; i < functions.size(); i++) {
            if (functions.get(i).getName().equals(functionName)) return i;
        }
        throw new IllegalArgumentException("Unknown function: " + functionName);
    }

    private static boolean hasInitial(PresentationGraph graph) {
        return graph.getNodes().stream().anyMatch(n -> n.getKind() == NodeKind.INITIAL);
    }

    private static Set<String> nodeIds(PresentationGraph graph) {
        return graph.getNodes().stream().map(GraphNode::getId).collect(Collectors.toSet());
    }
}
