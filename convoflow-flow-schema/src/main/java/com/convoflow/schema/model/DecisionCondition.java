package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One branch of a decision: {@code <action result> <operator> <value>} routes to {@code next_node_id}. */
public final class DecisionCondition {

    private final ConditionOperator operator;
    private final String value;
    private final String nextNodeId;

    @JsonCreator
    public DecisionCondition(
            @JsonProperty("operator") ConditionOperator operator,
            @JsonProperty("value") String value,
            @JsonProperty("next_node_id") String nextNodeId) {
        this.operator = operator != null ? operator : ConditionOperator.EQ;
        this.value = value != null ? value : "";
        this.nextNodeId = nextNodeId != null ? nextNodeId : "";
    }

    public ConditionOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    /** Target node id; empty when not yet connected. */
    @JsonProperty("next_node_id")
    public String getNextNodeId() {
        return nextNodeId;
    }

    public DecisionCondition withNextNodeId(String nextNodeId) {
        return new DecisionCondition(operator, value, nextNodeId);
    }

    /** Short label used on the branch edge, e.g. {@code == yes} or {@code not}. */
    public String label() {
        if (operator == ConditionOperator.NOT) return operator.getSymbol();
        return operator.getSymbol() + " " + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DecisionCondition that = (DecisionCondition) o;
        return operator == that.operator && Objects.equals(value, that.value)
                && Objects.equals(nextNodeId, that.nextNodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, value, nextNodeId);
    }
}
