package com.convoflow.graph.model;

import com.convoflow.graph.decision.DecisionProjection;
import com.convoflow.schema.model.FlowNode;
import com.convoflow.schema.model.NodeData;
import com.convoflow.schema.model.NodeKind;
import com.convoflow.schema.model.Position;

import java.util.Objects;

/**
 * Node of the presentation graph. Regular nodes carry {@link NodeData} and map 1:1 to document
 * nodes; decision nodes carry a {@link DecisionProjection} instead and are never persisted.
 */
public final class GraphNode {

    private final String id;
    private final NodeKind kind;
    private final String typeName;
    private final Position position;
    private final NodeData data;
    private final DecisionProjection projection;

    private GraphNode(String id, NodeKind kind, String typeName, Position position, NodeData data,
                      DecisionProjection projection) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.typeName = kind.isSpelledAs(typeName) ? typeName : kind.toValue();
        this.position = position != null ? position : Position.ORIGIN;
        this.data = data;
        this.projection = projection;
    }

    public static GraphNode of(FlowNode node) {
        return new GraphNode(node.getId(), node.getType(), node.getTypeName(), node.getPosition(), node.getData(), null);
    }

    public static GraphNode regular(String id, NodeKind kind, Position position, NodeData data) {
        if (kind == NodeKind.DECISION) {
            throw new IllegalArgumentException("Use GraphNode.decision for decision nodes");
        }
        return new GraphNode(id, kind, null, position, data != null ? data : NodeData.empty(null), null);
    }

    public static GraphNode decision(String id, Position position, DecisionProjection projection) {
        return new GraphNode(id, NodeKind.DECISION, null, position, null, Objects.requireNonNull(projection, "projection"));
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    /** Kind as spelled in the source document. */
    public String getTypeName() {
        return typeName;
    }

    public Position getPosition() {
        return position;
    }

    /** Node data; null for decision nodes. */
    public NodeData getData() {
        return data;
    }

    /** Decision projection; null for regular nodes. */
    public DecisionProjection getProjection() {
        return projection;
    }

    public boolean isDecision() {
        return kind == NodeKind.DECISION;
    }

    /** Label shown on the canvas. */
    public String label() {
        if (isDecision()) return projection.getLabel();
        return data.getLabel() != null ? data.getLabel() : id;
    }

    public GraphNode withId(String id) {
        return new GraphNode(id, kind, typeName, position, data, projection);
    }

    public GraphNode withPosition(Position position) {
        return new GraphNode(id, kind, typeName, position, data, projection);
    }

    public GraphNode withData(NodeData data) {
        if (isDecision()) throw new IllegalStateException("Decision node " + id + " has no node data");
        return new GraphNode(id, kind, typeName, position, data, null);
    }

    public GraphNode withProjection(DecisionProjection projection) {
        if (!isDecision()) throw new IllegalStateException("Node " + id + " is not a decision node");
        return new GraphNode(id, kind, typeName, position, null, projection);
    }

    /** Document node for a regular node. */
    public FlowNode toFlowNode() {
        if (isDecision()) throw new IllegalStateException("Decision node " + id + " is not part of the document");
        return new FlowNode(id, kind, typeName, position, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return id.equals(that.id) && kind == that.kind && typeName.equals(that.typeName) && position.equals(that.position)
                && Objects.equals(data, that.data) && Objects.equals(projection, that.projection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, typeName, position, data, projection);
    }

    @Override
    public String toString() {
        return "GraphNode{" + id + ", " + kind.toValue() + "}";
    }
}
