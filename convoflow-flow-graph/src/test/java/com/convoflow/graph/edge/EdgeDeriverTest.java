package com.convoflow.graph.edge;

import com.convoflow.graph.Fixtures;
import com.convoflow.graph.model.EdgeKind;
import com.convoflow.graph.model.GraphEdge;
import com.convoflow.graph.model.GraphNode;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.NodeData;
import com.convoflow.schema.model.NodeKind;
import com.convoflow.schema.model.Position;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EdgeDeriverTest {

    private static List<GraphNode> nodes(FlowDocument doc) {
        return doc.getNodes().stream().map(GraphNode::of).collect(Collectors.toList());
    }

    private static GraphNode node(String id, FlowFunction... functions) {
        return GraphNode.regular(id, NodeKind.STEP, Position.ORIGIN, NodeData.empty(id).withFunctions(List.of(functions)));
    }

    @Test
    void derive_emitsOneLabelledEdgePerDirectRoute() {
        List<GraphEdge> edges = EdgeDeriver.derive(List.of(
                node("a", FlowFunction.named("go_b", "d").withNextNodeId("b")),
                node("b")));

        assertEquals(1, edges.size());
        GraphEdge edge = edges.get(0);
        assertEquals("a", edge.getSource());
        assertEquals("b", edge.getTarget());
        assertEquals("go_b", edge.getLabel());
        assertEquals(EdgeKind.FUNCTION, edge.getKind());
        assertEquals(-1, edge.getLoopIndex());
    }

    @Test
    void derive_isDeterministic() {
        List<GraphNode> nodes = nodes(Fixtures.load("food_ordering.json"));

        List<GraphEdge> first = EdgeDeriver.derive(nodes);
        List<GraphEdge> second = EdgeDeriver.derive(nodes);

        assertEquals(first, second);
        assertTrue(EdgeDeriver.sameEdges(first, second));
    }

    @Test
    void derive_routesDecisionsThroughDecisionNode() {
        List<GraphEdge> edges = EdgeDeriver.derive(nodes(Fixtures.load("food_ordering.json")));

        List<GraphEdge> fromPizza = edges.stream()
                .filter(e -> e.getSource().equals("pizza") || e.getSource().startsWith("decision:pizza:"))
                .collect(Collectors.toList());
        assertEquals(4, fromPizza.size());
        GraphEdge entry = fromPizza.get(0);
        assertEquals(EdgeKind.DECISION_ENTRY, entry.getKind());
        assertEquals("decision:pizza:select_pizza_order", entry.getTarget());
        assertNull(entry.getLabel());
        assertEquals("== large", fromPizza.get(1).getLabel());
        assertEquals("in small, medium", fromPizza.get(2).getLabel());
        assertEquals("default", fromPizza.get(3).getLabel());
        assertEquals("start", fromPizza.get(3).getTarget());
    }

    @Test
    void derive_skipsUnroutedFunctions() {
        List<GraphEdge> edges = EdgeDeriver.derive(List.of(node("a", FlowFunction.named("idle", "d"))));

        assertTrue(edges.isEmpty());
    }

    @Test
    void derive_separatesSelfLoopsOnOneNode() {
        List<GraphEdge> loops = EdgeDeriver.derive(nodes(Fixtures.load("food_ordering.json"))).stream()
                .filter(GraphEdge::isSelfLoop)
                .collect(Collectors.toList());

        assertEquals(2, loops.size());
        assertEquals(0, loops.get(0).getLoopIndex());
        assertEquals(1, loops.get(1).getLoopIndex());
        assertEquals(0.0, loops.get(0).getLateralOffset());
        // "repeat_menu": 11 chars * 6 + 4, plus 4 padding
        assertEquals(74.0, loops.get(1).getLateralOffset());
        assertNotEquals(loops.get(0).getLateralOffset(), loops.get(1).getLateralOffset());
    }

    @Test
    void derive_selfLoopOffsetsStrictlyIncrease() {
        GraphNode busy = node("a",
                FlowFunction.named("x", "d").withNextNodeId("a"),
                FlowFunction.named("elsewhere", "d").withNextNodeId("b"),
                FlowFunction.named("yy", "d").withNextNodeId("a"),
                FlowFunction.named("zzz", "d").withNextNodeId("a"));

        List<GraphEdge> loops = EdgeDeriver.derive(List.of(busy, node("b"))).stream()
                .filter(GraphEdge::isSelfLoop)
                .collect(Collectors.toList());

        assertEquals(3, loops.size());
        for (int i = 1; i < loops.size(); i++) {
            assertTrue(loops.get(i).getLateralOffset() > loops.get(i - 1).getLateralOffset());
        }
    }

    @Test
    void deriveDocumentEdges_matchesStoredCache() {
        FlowDocument doc = Fixtures.load("food_ordering.json");

        assertEquals(doc.getEdges(), EdgeDeriver.deriveDocumentEdges(doc.getNodes()));
        assertTrue(EdgeDeriver.deriveDocumentEdges(doc.getNodes()).stream()
                .noneMatch(e -> e.getSource().startsWith("decision:") || e.getTarget().startsWith("decision:")));
    }
}
