package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Callable function of a node. Routing is either a plain {@code next_node_id} or a {@link Decision};
 * when both are present the decision wins and {@code next_node_id} is ignored.
 * Properties are JSON-Schema fragments keyed by argument name, kept in document order.
 */
public final class FlowFunction {

    private final String name;
    private final String description;
    private final Map<String, JsonNode> properties;
    private final List<String> required;
    private final String nextNodeId;
    private final Decision decision;

    @JsonCreator
    public FlowFunction(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("properties") Map<String, JsonNode> properties,
            @JsonProperty("required") List<String> required,
            @JsonProperty("next_node_id") String nextNodeId,
            @JsonProperty("decision") Decision decision) {
        this.name = name != null ? name : "";
        this.description = description != null ? description : "";
        this.properties = copyProperties(properties);
        this.required = required != null ? List.copyOf(required) : List.of();
        this.nextNodeId = nextNodeId;
        this.decision = decision;
    }

    public static FlowFunction named(String name, String description) {
        return new FlowFunction(name, description, null, null, null, null);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, JsonNode> getProperties() {
        return properties;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getRequired() {
        return required;
    }

    @JsonProperty("next_node_id")
    public String getNextNodeId() {
        return nextNodeId;
    }

    public Decision getDecision() {
        return decision;
    }

    @JsonIgnore
    public boolean hasDecision() {
        return decision != null;
    }

    /** Target the function routes to when it has no decision; null or blank means unrouted. */
    @JsonIgnore
    public boolean hasDirectTarget() {
        return decision == null && nextNodeId != null && !nextNodeId.isBlank();
    }

    public FlowFunction withName(String name) {
        return new FlowFunction(name, description, properties, required, nextNodeId, decision);
    }

    public FlowFunction withDescription(String description) {
        return new FlowFunction(name, description, properties, required, nextNodeId, decision);
    }

    public FlowFunction withProperties(Map<String, JsonNode> properties, List<String> required) {
        return new FlowFunction(name, description, properties, required, nextNodeId, decision);
    }

    public FlowFunction withNextNodeId(String nextNodeId) {
        return new FlowFunction(name, description, properties, required, nextNodeId, decision);
    }

    public FlowFunction withDecision(Decision decision) {
        return new FlowFunction(name, description, properties, required, nextNodeId, decision);
    }

    /** Structural copy; property schemas are deep-copied. */
    public FlowFunction copy() {
        return new FlowFunction(name, description, properties, required, nextNodeId, decision);
    }

    private static Map<String, JsonNode> copyProperties(Map<String, JsonNode> source) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v != null ? v.deepCopy() : null));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowFunction that = (FlowFunction) o;
        return Objects.equals(name, that.name) && Objects.equals(description, that.description)
                && Objects.equals(properties, that.properties) && Objects.equals(required, that.required)
                && Objects.equals(nextNodeId, that.nextNodeId) && Objects.equals(decision, that.decision);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, properties, required, nextNodeId, decision);
    }

    @Override
    public String toString() {
        return "FlowFunction{" + name + "}";
    }
}
