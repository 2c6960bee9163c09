package com.convoflow.graph.decision;

import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.FlowFunction;

import java.util.Objects;

/**
 * Data shown on a decision node. Always recomputed from the owning function, never edited directly.
 */
public final class DecisionProjection {

    private final String label;
    private final String action;
    private final int conditionCount;
    private final String sourceNodeId;
    private final String functionName;

    public DecisionProjection(String label, String action, int conditionCount, String sourceNodeId, String functionName) {
        this.label = label;
        this.action = action;
        this.conditionCount = conditionCount;
        this.sourceNodeId = sourceNodeId;
        this.functionName = functionName;
    }

    /** Projection of a function that has a decision. */
    public static DecisionProjection of(String sourceNodeId, FlowFunction function) {
        Decision decision = Objects.requireNonNull(function.getDecision(), "decision");
        return new DecisionProjection(function.getName(), decision.getAction(), decision.getConditions().size(),
                sourceNodeId, function.getName());
    }

    public String getLabel() {
        return label;
    }

    public String getAction() {
        return action;
    }

    public int getConditionCount() {
        return conditionCount;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public String getFunctionName() {
        return functionName;
    }

    public DecisionKey key() {
        return new DecisionKey(sourceNodeId, functionName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DecisionProjection that = (DecisionProjection) o;
        return conditionCount == that.conditionCount && Objects.equals(label, that.label)
                && Objects.equals(action, that.action) && Objects.equals(sourceNodeId, that.sourceNodeId)
                && Objects.equals(functionName, that.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, action, conditionCount, sourceNodeId, functionName);
    }
}
