package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A conversation step of the document. The {@code type} spelling read from JSON is kept and written
 * back, so a {@code step} node stays {@code step}.
 */
@JsonPropertyOrder({"id", "type", "position", "data"})
public final class FlowNode {

    private final String id;
    private final NodeKind type;
    private final String typeName;
    private final Position position;
    private final NodeData data;

    public FlowNode(String id, NodeKind type, Position position, NodeData data) {
        this(id, type, null, position, data);
    }

    /**
     * @param typeName spelling of the kind in the document; ignored unless it names {@code type}
     */
    public FlowNode(String id, NodeKind type, String typeName, Position position, NodeData data) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = type != null ? type : NodeKind.STEP;
        this.typeName = this.type.isSpelledAs(typeName) ? typeName : this.type.toValue();
        this.position = position != null ? position : Position.ORIGIN;
        this.data = data != null ? data : NodeData.empty(null);
    }

    @JsonCreator
    static FlowNode fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("position") Position position,
            @JsonProperty("data") NodeData data) {
        return new FlowNode(id, type != null ? NodeKind.fromValue(type) : null, type, position, data);
    }

    public String getId() {
        return id;
    }

    @JsonIgnore
    public NodeKind getType() {
        return type;
    }

    /** Kind as spelled in the document, e.g. {@code node} or its alias {@code step}. */
    @JsonProperty("type")
    public String getTypeName() {
        return typeName;
    }

    public Position getPosition() {
        return position;
    }

    public NodeData getData() {
        return data;
    }

    public FlowNode withId(String id) {
        return new FlowNode(id, type, typeName, position, data);
    }

    public FlowNode withPosition(Position position) {
        return new FlowNode(id, type, typeName, position, data);
    }

    public FlowNode withData(NodeData data) {
        return new FlowNode(id, type, typeName, position, data);
    }

    public FlowNode copy() {
        return new FlowNode(id, type, typeName, position, data.copy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowNode that = (FlowNode) o;
        return Objects.equals(id, that.id) && type == that.type && typeName.equals(that.typeName)
                && Objects.equals(position, that.position) && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, typeName, position, data);
    }

    @Override
    public String toString() {
        return "FlowNode{" + id + ", " + type.toValue() + "}";
    }
}
