package com.convoflow.codegen;

import com.convoflow.schema.FlowJson;
import com.convoflow.schema.model.FlowDocument;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonFlowGeneratorTest {

    private final PythonFlowGenerator generator = new PythonFlowGenerator();

    @Test
    void generate_minimalFlow() {
        String expected = """
                \"""Minimal (generated pipecat-flows scaffold)\"""

                from pipecat_flows import (
                    FlowArgs,
                    FlowManager,
                    FlowResult,
                    FlowsFunctionSchema,
                    NodeConfig,
                )


                async def start_record_name(args: FlowArgs, flow_manager: FlowManager) -> tuple[FlowResult, NodeConfig | None]:
                    \"""Record the user's name\"""
                    result: FlowResult = {"status": "success"}
                    return result, create_end_node()

                start_record_name_schema = FlowsFunctionSchema(
                    name="record_name",
                    description="Record the user's name",
                    properties={"name": {"type": "string", "description": "The user's name"}},
                    required=["name"],
                    handler=start_record_name,
                )

                def create_start_node() -> NodeConfig:
                    return NodeConfig(
                        name="start",
                        role_messages=[{"role": "system", "content": "You are a friendly assistant."}],
                        task_messages=[{"role": "system", "content": "Greet the user and ask for their name."}],
                        functions=[start_record_name_schema],
                    )

                def create_end_node() -> NodeConfig:
                    return NodeConfig(
                        name="end",
                        task_messages=[{"role": "system", "content": "Thank the user and say goodbye."}],
                        functions=[],
                        post_actions=[{"type": "end_conversation"}],
                    )

                def create_initial_node() -> NodeConfig:
                    return create_start_node()
                """;
        assertEquals(expected, generator.generate(Fixtures.load("minimal.json")));
    }

    @Test
    void generate_decisionBecomesOrderedIfElifChain() {
        String code = generator.generate(Fixtures.load("food_ordering.json"));

        String chain = """
                    value = args["size"]
                    if value == "large":
                        return result, create_confirm_node()
                    elif value in ["small", "medium"]:
                        return result, create_confirm_node()
                    else:
                        return result, create_start_node()
                """;
        assertTrue(code.contains(chain), code);
    }

    @Test
    void generate_contextStrategyAndGlobalsOnlyWhenPresent() {
        String food = generator.generate(Fixtures.load("food_ordering.json"));
        assertTrue(food.contains("    ContextStrategy,\n    ContextStrategyConfig,\n"));
        assertTrue(food.contains("context_strategy=ContextStrategyConfig(strategy=ContextStrategy.RESET_WITH_SUMMARY, "
                + "summary_prompt=\"Summarize the order so far.\"),"));
        assertTrue(food.contains("global_functions = [global_get_opening_hours_schema]\n"));
        assertTrue(food.contains("respond_immediately=True,"));
        assertTrue(food.contains("pre_actions=[{\"type\": \"tts_say\", \"text\": \"Welcome to Luigi's!\"}],"));
        assertTrue(food.contains("properties={\"count\": {\"type\": \"integer\", \"minimum\": 1, \"maximum\": 10}},"));

        String minimal = generator.generate(Fixtures.load("minimal.json"));
        assertFalse(minimal.contains("ContextStrategy"));
        assertFalse(minimal.contains("global_functions"));
    }

    @Test
    void generate_emitsNodesInDocumentOrder() {
        String code = generator.generate(Fixtures.load("food_ordering.json"));
        int start = code.indexOf("def create_start_node()");
        int pizza = code.indexOf("def create_pizza_node()");
        int sushi = code.indexOf("def create_sushi_node()");
        int confirm = code.indexOf("def create_confirm_node()");
        int end = code.indexOf("def create_end_node()");
        assertTrue(start > 0 && start < pizza && pizza < sushi && sushi < confirm && confirm < end);
        assertTrue(code.endsWith("def create_initial_node() -> NodeConfig:\n    return create_start_node()\n"));
    }

    @Test
    void generate_isDeterministic() {
        FlowDocument document = Fixtures.load("food_ordering.json");
        assertEquals(generator.generate(document), generator.generate(FlowJson.fromJson(FlowJson.toJson(document))));
    }

    @Test
    void generate_unaryNotAndConditionlessDecisions() {
        String code = generator.generate(FlowJson.fromJson("""
                {
                  "meta": {"name": "checks"},
                  "nodes": [
                    {"id": "a", "type": "initial", "position": {"x": 0, "y": 0}, "data": {"functions": [
                      {"name": "check", "description": "",
                       "decision": {"action": "args.get(\\"ok\\")", "conditions": [
                         {"operator": "not", "value": "", "next_node_id": "b"},
                         {"operator": ">=", "value": "3", "next_node_id": ""}
                       ], "default_next_node_id": "a"}},
                      {"name": "skip", "description": "",
                       "decision": {"action": "", "conditions": [], "default_next_node_id": "b"}}
                    ]}},
                    {"id": "b", "type": "end", "position": {"x": 0, "y": 100}, "data": {}}
                  ]
                }
                """));

        assertTrue(code.contains("""
                    value = args.get("ok")
                    if not value:
                        return result, create_b_node()
                    elif value >= 3:
                        return result, None
                    else:
                        return result, create_a_node()
                """), code);
        assertTrue(code.contains("""
                    value = None
                    return result, create_b_node()
                """), code);
    }

    @Test
    void generate_insertsMultiLineActionVerbatimWithIndentedContinuation() {
        String code = generator.generate(FlowJson.fromJson("""
                {
                  "meta": {"name": "lookup"},
                  "nodes": [
                    {"id": "a", "type": "initial", "position": {"x": 0, "y": 0}, "data": {"functions": [
                      {"name": "route", "description": "",
                       "decision": {"action": "lookup(\\n    args[\\"size\\"],\\n)  ", "conditions": [
                         {"operator": "==", "value": "large", "next_node_id": "b"}
                       ], "default_next_node_id": "a"}}
                    ]}},
                    {"id": "b", "type": "end", "position": {"x": 0, "y": 100}, "data": {}}
                  ]
                }
                """));

        assertTrue(code.contains("    value = lookup(\n        args[\"size\"],\n    )  \n    if value == \"large\":\n"), code);
    }

    @Test
    void generate_deduplicatesNamesDerivedFromIds() {
        String code = generator.generate(FlowJson.fromJson("""
                {
                  "meta": {"name": "names"},
                  "nodes": [
                    {"id": "a-b", "type": "initial", "position": {"x": 0, "y": 0}, "data": {"functions": [
                      {"name": "go", "description": "", "next_node_id": "a_b"}
                    ]}},
                    {"id": "a_b", "type": "node", "position": {"x": 0, "y": 100}, "data": {"functions": [
                      {"name": "go", "description": "", "next_node_id": "a-b"}
                    ]}}
                  ]
                }
                """));

        assertTrue(code.contains("def create_a_b_node() -> NodeConfig:\n    return NodeConfig(\n        name=\"a-b\","));
        assertTrue(code.contains("def create_a_b_node_2() -> NodeConfig:\n    return NodeConfig(\n        name=\"a_b\","));
        assertTrue(code.contains("async def a_b_go(args"));
        assertTrue(code.contains("async def a_b_go_2(args"));
        assertTrue(code.contains("    return result, create_a_b_node_2()\n"));
        assertTrue(code.contains("    return create_a_b_node()\n"));
    }

    @Test
    void generate_stubsFunctionActionHandlers() {
        String code = generator.generate(FlowJson.fromJson("""
                {
                  "meta": {"name": "actions"},
                  "nodes": [
                    {"id": "a", "type": "initial", "position": {"x": 0, "y": 0}, "data": {
                      "pre_actions": [{"type": "function", "handler": "log_entry"}]
                    }}
                  ]
                }
                """));

        assertTrue(code.contains("async def log_entry(action: dict, flow_manager: FlowManager) -> None:\n    pass\n"));
        assertTrue(code.contains("pre_actions=[{\"type\": \"function\", \"handler\": log_entry}],"));
        assertTrue(code.contains("    FlowManager,\n    NodeConfig,\n)"));
        assertFalse(code.contains("FlowsFunctionSchema"));
    }
}
