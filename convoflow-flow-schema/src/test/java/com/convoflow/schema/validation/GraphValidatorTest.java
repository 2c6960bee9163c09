package com.convoflow.schema.validation;

import com.convoflow.schema.FlowJson;
import com.convoflow.schema.model.DocumentEdge;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowNode;
import com.convoflow.schema.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator();

    private static FlowDocument fixture(String name) throws IOException {
        try (InputStream in = GraphValidatorTest.class.getResourceAsStream("/flows/" + name)) {
            return FlowJson.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    private static boolean anyMessageContains(List<ValidationError> errors, String text) {
        return errors.stream().anyMatch(e -> e.getMessage().contains(text));
    }

    @Test
    void validate_minimalHasNoErrors() throws IOException {
        assertEquals(List.of(), validator.validate(fixture("minimal.json")));
        assertEquals(List.of(), validator.validate(fixture("food_ordering.json")));
    }

    @Test
    void validate_detectsDuplicateNodeId() throws IOException {
        FlowDocument doc = fixture("minimal.json");
        List<FlowNode> nodes = new ArrayList<>(doc.getNodes());
        nodes.add(nodes.get(0));

        List<ValidationError> errors = validator.validate(doc.withNodes(nodes));

        assertTrue(anyMessageContains(errors, "Duplicate node id"));
        assertTrue(errors.stream().allMatch(e -> e.getCategory() == ValidationError.Category.SEMANTIC_GRAPH));
    }

    @Test
    void validate_rejectsNodeIdInDecisionNamespace() {
        FlowDocument doc = FlowJson.fromJson("""
                {
                  "meta": {"name": "reserved"},
                  "nodes": [
                    {"id": "a", "type": "initial", "position": {"x": 0, "y": 0}, "data": {"functions": [
                      {"name": "route", "description": "", "decision": {"action": "args", "conditions": [],
                       "default_next_node_id": "b"}}
                    ]}},
                    {"id": "b", "type": "end", "position": {"x": 0, "y": 100}, "data": {}},
                    {"id": "decision:a:route", "type": "node", "position": {"x": 0, "y": 200}, "data": {}}
                  ]
                }
                """);

        List<ValidationError> errors = validator.validate(doc);

        assertEquals(1, errors.size());
        assertEquals("Node id uses reserved prefix 'decision:': decision:a:route", errors.get(0).getMessage());
        assertTrue(new FlowValidator().validate(doc).firstError().getMessage().contains("reserved prefix"));
    }

    @Test
    void validate_detectsDanglingFunctionReference() throws IOException {
        FlowDocument doc = fixture("minimal.json");
        FlowNode start = doc.getNodes().get(0);
        FlowNode broken = start.withData(start.getData().withFunction(0,
                start.getData().getFunctions().get(0).withNextNodeId("nowhere")));

        List<ValidationError> errors = validator.validate(doc.withNodes(List.of(broken, doc.getNodes().get(1))));

        assertTrue(anyMessageContains(errors,
                "Function 'record_name' in node 'start' references unknown node: nowhere"));
    }

    @Test
    void validate_detectsUnknownEdgeEndpoint() throws IOException {
        FlowDocument doc = fixture("minimal.json");

        List<ValidationError> errors = validator.validate(
                doc.withEdges(List.of(new DocumentEdge("e1", "start", "ghost", null))));

        assertTrue(anyMessageContains(errors, "Edge references unknown node: ghost"));
    }

    @Test
    void validate_detectsDanglingDecisionTargets() throws IOException {
        FlowDocument doc = fixture("food_ordering.json");
        List<FlowNode> nodes = new ArrayList<>(doc.getNodes());
        nodes.removeIf(n -> n.getId().equals("confirm"));

        List<ValidationError> errors = validator.validate(doc.withNodes(nodes).withEdges(List.of()));

        assertTrue(anyMessageContains(errors,
                "Function 'select_pizza_order' in node 'pizza' references unknown node: confirm"));
        assertTrue(anyMessageContains(errors,
                "Function 'select_sushi_order' in node 'sushi' references unknown node: confirm"));
    }

    @Test
    void validate_requiresExactlyOneInitialNode() throws IOException {
        FlowDocument doc = fixture("minimal.json");
        FlowNode end = doc.getNodes().get(1);
        FlowNode secondInitial = new FlowNode(end.getId(), NodeKind.INITIAL, end.getPosition(), end.getData());

        List<ValidationError> errors = validator.validate(doc.withNodes(List.of(doc.getNodes().get(0), secondInitial)));

        assertTrue(anyMessageContains(errors, "exactly one initial node (found 2)"));
    }
}
