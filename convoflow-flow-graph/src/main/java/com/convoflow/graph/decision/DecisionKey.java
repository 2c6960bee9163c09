package com.convoflow.graph.decision;

import java.util.Objects;

/** The (owning node, function) pair a decision node stands for. */
public final class DecisionKey {

    private final String sourceNodeId;
    private final String functionName;

    public DecisionKey(String sourceNodeId, String functionName) {
        this.sourceNodeId = Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        this.functionName = Objects.requireNonNull(functionName, "functionName");
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public String getFunctionName() {
        return functionName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DecisionKey that = (DecisionKey) o;
        return sourceNodeId.equals(that.sourceNodeId) && functionName.equals(that.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceNodeId, functionName);
    }

    @Override
    public String toString() {
        return sourceNodeId + "." + functionName;
    }
}
