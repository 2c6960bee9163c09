package com.convoflow.schema.validation;

import java.util.Objects;

/**
 * A routing field naming a node that does not exist. Shown next to the field while editing;
 * never repaired automatically. The field is {@code next_node_id}, {@code default_next_node_id}
 * or {@code conditions[i].next_node_id}.
 */
public final class DanglingReference {

    private final String nodeId;
    private final String functionName;
    private final String field;
    private final String target;

    public DanglingReference(String nodeId, String functionName, String field, String target) {
        this.nodeId = nodeId;
        this.functionName = functionName;
        this.field = field;
        this.target = target;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getField() {
        return field;
    }

    public String getTarget() {
        return target;
    }

    public String getMessage() {
        return "Function '" + functionName + "' in node '" + nodeId + "' references unknown node: " + target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DanglingReference that = (DanglingReference) o;
        return Objects.equals(nodeId, that.nodeId) && Objects.equals(functionName, that.functionName)
                && Objects.equals(field, that.field) && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, functionName, field, target);
    }

    @Override
    public String toString() {
        return nodeId + "." + functionName + "." + field + " -> " + target;
    }
}
