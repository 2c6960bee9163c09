package com.convoflow.graph.decision;

import com.convoflow.config.EditorConfig;
import com.convoflow.graph.model.GraphNode;
import com.convoflow.schema.model.ConditionOperator;
import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.DecisionCondition;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.NodeData;
import com.convoflow.schema.model.NodeKind;
import com.convoflow.schema.model.Position;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionNodeSynthesizerTest {

    private final DecisionNodeSynthesizer synthesizer = new DecisionNodeSynthesizer(EditorConfig.defaults());

    private static FlowFunction decisionFunction(String name, String action, int conditions) {
        List<DecisionCondition> list = new ArrayList<>();
        for (int i = 0; i < conditions; i++) {
            list.add(new DecisionCondition(ConditionOperator.EQ, String.valueOf(i), "end"));
        }
        return FlowFunction.named(name, "d").withDecision(new Decision(action, list, "end", null));
    }

    private static GraphNode node(String id, Position position, FlowFunction... functions) {
        return GraphNode.regular(id, NodeKind.STEP, position, NodeData.empty(id).withFunctions(List.of(functions)));
    }

    private static List<GraphNode> decisions(List<GraphNode> nodes) {
        return nodes.stream().filter(GraphNode::isDecision).collect(Collectors.toList());
    }

    @Test
    void reconcile_createsOneDecisionNodePerDecisionFunction() {
        List<GraphNode> nodes = List.of(
                node("a", Position.ORIGIN,
                        decisionFunction("check", "args['x']", 2),
                        FlowFunction.named("plain", "d").withNextNodeId("end"),
                        decisionFunction("route", "args['y']", 1)),
                node("b", Position.ORIGIN, decisionFunction("pick", "args['z']", 0)),
                node("end", Position.ORIGIN));

        List<GraphNode> result = synthesizer.reconcile(nodes);

        List<GraphNode> decisionNodes = decisions(result);
        assertEquals(3, decisionNodes.size());
        assertEquals(List.of("decision:a:check", "decision:a:route", "decision:b:pick"),
                decisionNodes.stream().map(GraphNode::getId).collect(Collectors.toList()));
        DecisionProjection check = decisionNodes.get(0).getProjection();
        assertEquals("check", check.getLabel());
        assertEquals("args['x']", check.getAction());
        assertEquals(2, check.getConditionCount());
        assertEquals("a", check.getSourceNodeId());
        assertEquals("check", check.getFunctionName());
        assertEquals(nodes, result.subList(0, 3));
    }

    @Test
    void reconcile_placesNewNodesAtStoredOrDefaultPosition() {
        FlowFunction stored = FlowFunction.named("stored", "d")
                .withDecision(Decision.withDefault("end").withDecisionNodePosition(new Position(7, 8)));
        List<GraphNode> nodes = List.of(
                node("a", new Position(100, 50), decisionFunction("first", "", 0), stored, decisionFunction("third", "", 0)));

        List<GraphNode> decisionNodes = decisions(synthesizer.reconcile(nodes));

        assertEquals(new Position(350, 200), decisionNodes.get(0).getPosition());
        assertEquals(new Position(7, 8), decisionNodes.get(1).getPosition());
        assertEquals(new Position(350, 400), decisionNodes.get(2).getPosition());
    }

    @Test
    void reconcile_returnsSameListWhenNothingChanges() {
        List<GraphNode> once = synthesizer.reconcile(List.of(node("a", Position.ORIGIN, decisionFunction("check", "x", 1))));

        assertSame(once, synthesizer.reconcile(once));
    }

    @Test
    void reconcile_refreshesProjectionAndKeepsPosition() {
        GraphNode owner = node("a", Position.ORIGIN, decisionFunction("check", "old", 1));
        List<GraphNode> settled = new ArrayList<>(synthesizer.reconcile(List.of(owner)));
        settled.set(1, settled.get(1).withPosition(new Position(-40, 90)));
        settled.set(0, owner.withData(owner.getData().withFunction(0, decisionFunction("check", "new", 3))));

        List<GraphNode> result = synthesizer.reconcile(settled);

        GraphNode decision = decisions(result).get(0);
        assertEquals("new", decision.getProjection().getAction());
        assertEquals(3, decision.getProjection().getConditionCount());
        assertEquals(new Position(-40, 90), decision.getPosition());
    }

    @Test
    void reconcile_removesOnlyOrphanedDecisionNode() {
        GraphNode a = node("a", Position.ORIGIN, decisionFunction("one", "", 0), decisionFunction("two", "", 0));
        GraphNode b = node("b", Position.ORIGIN, decisionFunction("three", "", 0));
        List<GraphNode> settled = synthesizer.reconcile(List.of(a, b));
        assertEquals(3, decisions(settled).size());

        List<GraphNode> edited = new ArrayList<>(settled);
        edited.set(0, a.withData(a.getData().withFunction(0, a.getData().getFunctions().get(0).withDecision(null))));
        List<GraphNode> result = synthesizer.reconcile(edited);

        assertEquals(List.of("decision:a:two", "decision:b:three"),
                decisions(result).stream().map(GraphNode::getId).collect(Collectors.toList()));
        assertEquals(settled.get(3), result.get(2));
        assertEquals(settled.get(4), result.get(3));
    }

    @Test
    void reconcile_removesDecisionNodesOfDeletedOwner() {
        GraphNode a = node("a", Position.ORIGIN, decisionFunction("one", "", 0));
        GraphNode b = node("b", Position.ORIGIN, decisionFunction("two", "", 0));
        List<GraphNode> settled = new ArrayList<>(synthesizer.reconcile(List.of(a, b)));

        settled.remove(0);
        List<GraphNode> result = synthesizer.reconcile(settled);

        assertEquals(List.of("b", "decision:b:two"), result.stream().map(GraphNode::getId).collect(Collectors.toList()));
    }

    @Test
    void reconcile_followsFunctionRename() {
        GraphNode a = node("a", Position.ORIGIN, decisionFunction("one", "", 0));
        List<GraphNode> settled = new ArrayList<>(synthesizer.reconcile(List.of(a)));
        settled.set(0, a.withData(a.getData().withFunction(0, a.getData().getFunctions().get(0).withName("uno"))));

        List<GraphNode> result = synthesizer.reconcile(settled);

        assertEquals(1, decisions(result).size());
        assertTrue(result.stream().anyMatch(n -> n.getId().equals("decision:a:uno")));
    }
}
