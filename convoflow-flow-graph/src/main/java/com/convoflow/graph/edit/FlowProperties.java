package com.convoflow.graph.edit;

import com.convoflow.graph.model.GraphNode;
import com.convoflow.schema.model.FlowFunction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class FlowProperties {

    private static final List<String> KEPT_FIELDS = List.of("type", "description", "minimum", "maximum", "pattern");

    private FlowProperties() {
    }

    /**
     * Every distinct property name used by a function of a regular node. The first definition of a
     * name wins; the result is sorted by name.
     */
    public static List<SuggestedProperty> collectSuggestedProperties(List<GraphNode> nodes) {
        Map<String, JsonNode> byName = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            if (node.isDecision()) continue;
            for (FlowFunction function : node.getData().getFunctions()) {
                for (Map.Entry<String, JsonNode> e : function.getProperties().entrySet()) {
                    String name = e.getKey();
                    if (name.isBlank() || byName.containsKey(name)) continue;
                    byName.put(name, reduce(e.getValue()));
                }
            }
        }
        List<SuggestedProperty> result = new ArrayList<>(byName.size());
        byName.forEach((name, schema) -> result.add(new SuggestedProperty(name, schema)));
        result.sort(Comparator.comparing(SuggestedProperty::getName));
        return result;
    }

    private static JsonNode reduce(JsonNode property) {
        ObjectNode reduced = JsonNodeFactory.instance.objectNode();
        if (property == null || !property.isObject()) return reduced;
        for (String field : KEPT_FIELDS) {
            JsonNode v = property.get(field);
            if (v != null && !v.isNull()) reduced.set(field, v.deepCopy());
        }
        JsonNode values = property.get("enum");
        if (values != null && values.isArray()) {
            ArrayNode asText = reduced.putArray("enum");
            values.forEach(v -> asText.add(v.asText()));
        }
        return reduced;
    }
}
