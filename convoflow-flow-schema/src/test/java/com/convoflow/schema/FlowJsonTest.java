package com.convoflow.schema;

import com.convoflow.schema.model.ConditionOperator;
import com.convoflow.schema.model.ContextStrategy;
import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.FlowAction;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.FlowNode;
import com.convoflow.schema.model.NodeKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowJsonTest {

    static String resource(String name) {
        try (InputStream in = FlowJsonTest.class.getResourceAsStream("/flows/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void fromJson_readsMinimalDocument() {
        FlowDocument doc = FlowJson.fromJson(resource("minimal.json"));

        assertEquals("https://flows.pipecat.ai/schema/flow.json", doc.getSchemaUri());
        assertNull(doc.getDocumentId());
        assertEquals("Minimal", doc.getMeta().getName());
        assertEquals(2, doc.getNodes().size());
        FlowNode start = doc.getNodes().get(0);
        assertEquals(NodeKind.INITIAL, start.getType());
        FlowFunction recordName = start.getData().getFunctions().get(0);
        assertEquals("record_name", recordName.getName());
        assertEquals("end", recordName.getNextNodeId());
        assertEquals(List.of("name"), recordName.getRequired());
        assertEquals("string", recordName.getProperties().get("name").get("type").asText());
        assertEquals(1, doc.getEdges().size());
    }

    @Test
    void fromJson_readsDecisionAndContextStrategy() {
        FlowDocument doc = FlowJson.fromJson(resource("food_ordering.json"));

        FlowNode pizza = doc.findNode("pizza").orElseThrow();
        Decision decision = pizza.getData().getFunctions().get(0).getDecision();
        assertNotNull(decision);
        assertEquals("args[\"size\"]", decision.getAction());
        assertEquals(ConditionOperator.IN, decision.getConditions().get(1).getOperator());
        assertEquals("start", decision.getDefaultNextNodeId());
        assertEquals(-200.0, decision.getDecisionNodePosition().getX());
        assertEquals(ContextStrategy.RESET_WITH_SUMMARY, pizza.getData().getContextStrategy().getStrategy());
        assertEquals("Luigi's", doc.getContext().get("restaurant").asText());
        assertEquals("get_opening_hours", doc.getGlobalFunctions().get(0).getName());
    }

    @Test
    void toJson_writesSnakeCaseAndSkipsNulls() {
        FlowDocument doc = FlowJson.fromJson(resource("food_ordering.json"));

        JsonNode tree = FlowJson.readTree(FlowJson.toJson(doc));

        assertEquals("food-ordering", tree.get("$id").asText());
        JsonNode pizzaFn = tree.get("nodes").get(1).get("data").get("functions").get(0);
        assertTrue(pizzaFn.get("decision").has("default_next_node_id"));
        assertTrue(pizzaFn.get("decision").has("decision_node_position"));
        assertFalse(pizzaFn.has("next_node_id"));
        assertFalse(pizzaFn.has("hasDecision"));
        assertEquals("RESET_WITH_SUMMARY",
                tree.get("nodes").get(1).get("data").get("context_strategy").get("strategy").asText());
        assertEquals("initial", tree.get("nodes").get(0).get("type").asText());
    }

    @Test
    void roundTrip_preservesDocument() {
        FlowDocument doc = FlowJson.fromJson(resource("food_ordering.json"));

        FlowDocument again = FlowJson.fromJson(FlowJson.toJson(doc));

        assertEquals(doc, again);
        assertEquals(doc, FlowJson.fromTree(FlowJson.toTree(doc)));
    }

    @Test
    void actionExtraFields_arePassedThrough() {
        String json = """
                {
                  "meta": {"name": "x"},
                  "nodes": [
                    {"id": "a", "type": "initial", "position": {"x": 0, "y": 0},
                     "data": {"pre_actions": [{"type": "function", "handler": "log_entry", "level": "debug", "retries": 2}]}}
                  ]
                }
                """;

        FlowDocument doc = FlowJson.fromJson(json);
        FlowAction action = doc.getNodes().get(0).getData().getPreActions().get(0);
        assertEquals("function", action.getType());
        assertEquals("log_entry", action.getHandler());
        assertEquals("debug", action.getParams().get("level").asText());
        assertEquals(2, action.getParams().get("retries").asInt());

        JsonNode written = FlowJson.toTree(doc).get("nodes").get(0).get("data").get("pre_actions").get(0);
        assertEquals("debug", written.get("level").asText());
        assertEquals(action, FlowJson.fromJson(FlowJson.toJson(doc)).getNodes().get(0).getData().getPreActions().get(0));
    }

    @Test
    void stepAlias_readsAsNodeKindAndKeepsSpelling() {
        String json = """
                {"meta": {"name": "x"}, "nodes": [{"id": "a", "type": "step", "position": {"x": 1, "y": 2}, "data": {}}]}
                """;

        FlowDocument doc = FlowJson.fromJson(json);

        assertEquals(NodeKind.STEP, doc.getNodes().get(0).getType());
        assertEquals("step", doc.getNodes().get(0).getTypeName());
        assertEquals("step", FlowJson.toTree(doc).get("nodes").get(0).get("type").asText());
        assertEquals("node", FlowJson.toTree(doc.withNodes(List.of(new FlowNode("b", NodeKind.STEP, null, null))))
                .get("nodes").get(0).get("type").asText());
    }

    @Test
    void fromJson_malformedThrowsUncheckedIOException() {
        assertThrows(UncheckedIOException.class, () -> FlowJson.fromJson("{\"nodes\": ["));
    }
}
