package com.convoflow.editor;

import java.util.Objects;

/**
 * What the user has selected in the editor: a node, optionally one of its functions and one of
 * that function's decision conditions. Owned by the UI layer; the session only stores it.
 */
public final class SelectionContext {

    public static final SelectionContext NONE = new SelectionContext(null, -1, -1);

    private final String nodeId;
    private final int functionIndex;
    private final int conditionIndex;

    private SelectionContext(String nodeId, int functionIndex, int conditionIndex) {
        this.nodeId = nodeId;
        this.functionIndex = functionIndex;
        this.conditionIndex = conditionIndex;
    }

    public static SelectionContext ofNode(String nodeId) {
        return new SelectionContext(Objects.requireNonNull(nodeId, "nodeId"), -1, -1);
    }

    public static SelectionContext ofFunction(String nodeId, int functionIndex) {
        return new SelectionContext(Objects.requireNonNull(nodeId, "nodeId"), functionIndex, -1);
    }

    public static SelectionContext ofCondition(String nodeId, int functionIndex, int conditionIndex) {
        return new SelectionContext(Objects.requireNonNull(nodeId, "nodeId"), functionIndex, conditionIndex);
    }

    /** Selected node id, or null when nothing is selected. */
    public String getNodeId() {
        return nodeId;
    }

    /** Index of the selected function, -1 for none. */
    public int getFunctionIndex() {
        return functionIndex;
    }

    /** Index of the selected condition, -1 for none. */
    public int getConditionIndex() {
        return conditionIndex;
    }

    public boolean isEmpty() {
        return nodeId == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectionContext that = (SelectionContext) o;
        return functionIndex == that.functionIndex
                && conditionIndex == that.conditionIndex
                && Objects.equals(nodeId, that.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, functionIndex, conditionIndex);
    }

    @Override
    public String toString() {
        return "SelectionContext{nodeId=" + nodeId + ", functionIndex=" + functionIndex
                + ", conditionIndex=" + conditionIndex + "}";
    }
}
