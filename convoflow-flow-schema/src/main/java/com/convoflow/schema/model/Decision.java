package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conditional routing of a function. The action expression is opaque text; conditions are tried in
 * order as an if/elif chain and {@code default_next_node_id} is the final else. The optional
 * {@code decision_node_position} is the only persisted trace of the synthetic decision node.
 */
public final class Decision {

    private final String action;
    private final List<DecisionCondition> conditions;
    private final String defaultNextNodeId;
    private final Position decisionNodePosition;

    @JsonCreator
    public Decision(
            @JsonProperty("action") String action,
            @JsonProperty("conditions") List<DecisionCondition> conditions,
            @JsonProperty("default_next_node_id") String defaultNextNodeId,
            @JsonProperty("decision_node_position") Position decisionNodePosition) {
        this.action = action != null ? action : "";
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.defaultNextNodeId = defaultNextNodeId != null ? defaultNextNodeId : "";
        this.decisionNodePosition = decisionNodePosition;
    }

    /** New decision with no conditions, routing everything to the given default. */
    public static Decision withDefault(String defaultNextNodeId) {
        return new Decision("", List.of(), defaultNextNodeId, null);
    }

    public String getAction() {
        return action;
    }

    public List<DecisionCondition> getConditions() {
        return conditions;
    }

    @JsonProperty("default_next_node_id")
    public String getDefaultNextNodeId() {
        return defaultNextNodeId;
    }

    @JsonProperty("decision_node_position")
    public Position getDecisionNodePosition() {
        return decisionNodePosition;
    }

    public Decision withAction(String action) {
        return new Decision(action, conditions, defaultNextNodeId, decisionNodePosition);
    }

    public Decision withConditions(List<DecisionCondition> conditions) {
        return new Decision(action, conditions, defaultNextNodeId, decisionNodePosition);
    }

    public Decision withCondition(int index, DecisionCondition condition) {
        List<DecisionCondition> updated = new ArrayList<>(conditions);
        updated.set(index, condition);
        return withConditions(updated);
    }

    public Decision withDefaultNextNodeId(String defaultNextNodeId) {
        return new Decision(action, conditions, defaultNextNodeId, decisionNodePosition);
    }

    public Decision withDecisionNodePosition(Position position) {
        return new Decision(action, conditions, defaultNextNodeId, position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Decision that = (Decision) o;
        return Objects.equals(action, that.action) && Objects.equals(conditions, that.conditions)
                && Objects.equals(defaultNextNodeId, that.defaultNextNodeId)
                && Objects.equals(decisionNodePosition, that.decisionNodePosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, conditions, defaultNextNodeId, decisionNodePosition);
    }
}
