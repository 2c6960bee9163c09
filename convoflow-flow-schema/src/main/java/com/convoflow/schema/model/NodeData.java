package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Payload of a flow node: messages, functions, actions and context strategy.
 */
public final class NodeData {

    private final String label;
    private final List<FlowMessage> roleMessages;
    private final List<FlowMessage> taskMessages;
    private final List<FlowFunction> functions;
    private final List<FlowAction> preActions;
    private final List<FlowAction> postActions;
    private final ContextStrategyConfig contextStrategy;
    private final Boolean respondImmediately;

    @JsonCreator
    public NodeData(
            @JsonProperty("label") String label,
            @JsonProperty("role_messages") List<FlowMessage> roleMessages,
            @JsonProperty("task_messages") List<FlowMessage> taskMessages,
            @JsonProperty("functions") List<FlowFunction> functions,
            @JsonProperty("pre_actions") List<FlowAction> preActions,
            @JsonProperty("post_actions") List<FlowAction> postActions,
            @JsonProperty("context_strategy") ContextStrategyConfig contextStrategy,
            @JsonProperty("respond_immediately") Boolean respondImmediately) {
        this.label = label;
        this.roleMessages = roleMessages != null ? List.copyOf(roleMessages) : List.of();
        this.taskMessages = taskMessages != null ? List.copyOf(taskMessages) : List.of();
        this.functions = functions != null ? List.copyOf(functions) : List.of();
        this.preActions = preActions != null ? List.copyOf(preActions) : List.of();
        this.postActions = postActions != null ? List.copyOf(postActions) : List.of();
        this.contextStrategy = contextStrategy;
        this.respondImmediately = respondImmediately;
    }

    public static NodeData empty(String label) {
        return new NodeData(label, null, null, null, null, null, null, null);
    }

    public String getLabel() {
        return label;
    }

    @JsonProperty("role_messages")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<FlowMessage> getRoleMessages() {
        return roleMessages;
    }

    @JsonProperty("task_messages")
    public List<FlowMessage> getTaskMessages() {
        return taskMessages;
    }

    public List<FlowFunction> getFunctions() {
        return functions;
    }

    @JsonProperty("pre_actions")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<FlowAction> getPreActions() {
        return preActions;
    }

    @JsonProperty("post_actions")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<FlowAction> getPostActions() {
        return postActions;
    }

    @JsonProperty("context_strategy")
    public ContextStrategyConfig getContextStrategy() {
        return contextStrategy;
    }

    @JsonProperty("respond_immediately")
    public Boolean getRespondImmediately() {
        return respondImmediately;
    }

    public FlowFunction findFunction(String name) {
        for (FlowFunction f : functions) {
            if (f.getName().equals(name)) return f;
        }
        return null;
    }

    public NodeData withLabel(String label) {
        return new NodeData(label, roleMessages, taskMessages, functions, preActions, postActions,
                contextStrategy, respondImmediately);
    }

    public NodeData withFunctions(List<FlowFunction> functions) {
        return new NodeData(label, roleMessages, taskMessages, functions, preActions, postActions,
                contextStrategy, respondImmediately);
    }

    public NodeData withFunction(int index, FlowFunction function) {
        List<FlowFunction> updated = new ArrayList<>(functions);
        updated.set(index, function);
        return withFunctions(updated);
    }

    public NodeData withContextStrategy(ContextStrategyConfig contextStrategy) {
        return new NodeData(label, roleMessages, taskMessages, functions, preActions, postActions,
                contextStrategy, respondImmediately);
    }

    /** Structural copy: functions and actions are copied, messages are immutable and shared. */
    public NodeData copy() {
        List<FlowFunction> fns = new ArrayList<>(functions.size());
        functions.forEach(f -> fns.add(f.copy()));
        List<FlowAction> pre = new ArrayList<>(preActions.size());
        preActions.forEach(a -> pre.add(a.copy()));
        List<FlowAction> post = new ArrayList<>(postActions.size());
        postActions.forEach(a -> post.add(a.copy()));
        return new NodeData(label, roleMessages, taskMessages, fns, pre, post, contextStrategy, respondImmediately);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeData that = (NodeData) o;
        return Objects.equals(label, that.label) && Objects.equals(roleMessages, that.roleMessages)
                && Objects.equals(taskMessages, that.taskMessages) && Objects.equals(functions, that.functions)
                && Objects.equals(preActions, that.preActions) && Objects.equals(postActions, that.postActions)
                && Objects.equals(contextStrategy, that.contextStrategy)
                && Objects.equals(respondImmediately, that.respondImmediately);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, roleMessages, taskMessages, functions, preActions, postActions,
                contextStrategy, respondImmediately);
    }
}
