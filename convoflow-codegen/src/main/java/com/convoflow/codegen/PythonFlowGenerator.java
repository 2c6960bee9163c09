package com.convoflow.codegen;

import com.convoflow.schema.model.ConditionOperator;
import com.convoflow.schema.model.ContextStrategyConfig;
import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.DecisionCondition;
import com.convoflow.schema.model.FlowAction;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.FlowMessage;
import com.convoflow.schema.model.FlowNode;
import com.convoflow.schema.model.NodeData;
import com.convoflow.schema.util.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expands a flow document into a pipecat-flows Python scaffold.
 *
 * <p>Output depends only on the document: nodes, functions, properties and conditions are
 * emitted in document order, names are derived from ids and de-duplicated in that order.
 * The generator does not validate its input; {@link FlowCompiler} is the gate.
 */
public final class PythonFlowGenerator {

    private static final String INDENT = "    ";

    public String generate(FlowDocument document) {
        Names names = Names.of(document);
        StringBuilder out = new StringBuilder();

        out.append("\"\"\"").append(escapeDocstring(title(document))).append("\"\"\"\n\n");
        out.append(imports(document)).append('\n');

        for (String handler : actionHandlers(document)) {
            out.append('\n');
            out.append("async def ").append(handler).append("(action: dict, flow_manager: FlowManager) -> None:\n");
            out.append(INDENT).append("pass\n");
        }

        if (!document.getGlobalFunctions().isEmpty()) {
            List<String> schemas = new ArrayList<>();
            for (FlowFunction function : document.getGlobalFunctions()) {
                String handler = names.globalHandler(function);
                out.append('\n');
                appendHandler(out, handler, function, names);
                out.append('\n');
                appendSchema(out, handler, function);
                schemas.add(handler + "_schema");
            }
            out.append('\n');
            out.append("global_functions = [").append(String.join(", ", schemas)).append("]\n");
        }

        for (FlowNode node : document.getNodes()) {
            NodeData data = node.getData();
            List<String> schemas = new ArrayList<>();
            for (FlowFunction function : data.getFunctions()) {
                String handler = names.handler(node, function);
                out.append('\n');
                appendHandler(out, handler, function, names);
                out.append('\n');
                appendSchema(out, handler, function);
                schemas.add(handler + "_schema");
            }
            out.append('\n');
            appendFactory(out, node, schemas, names);
        }

        document.getInitialNode().ifPresent(initial -> {
            out.append('\n');
            out.append("def create_initial_node() -> NodeConfig:\n");
            out.append(INDENT).append("return ").append(names.factory(initial.getId())).append("()\n");
        });
        return out.toString();
    }

    private static String title(FlowDocument document) {
        String name = document.getMeta() != null ? document.getMeta().getName() : null;
        return (name != null && !name.isBlank() ? name : "Flow") + " (generated pipecat-flows scaffold)";
    }

    private static String imports(FlowDocument document) {
        Set<String> symbols = new TreeSet<>();
        symbols.add("NodeConfig");
        boolean hasFunctions = !document.getGlobalFunctions().isEmpty()
                || document.getNodes().stream().anyMatch(n -> !n.getData().getFunctions().isEmpty());
        if (hasFunctions) {
            symbols.add("FlowArgs");
            symbols.add("FlowResult");
            symbols.add("FlowsFunctionSchema");
        }
        if (hasFunctions || !actionHandlers(document).isEmpty()) {
            symbols.add("FlowManager");
        }
        if (document.getNodes().stream().anyMatch(n -> n.getData().getContextStrategy() != null)) {
            symbols.add("ContextStrategy");
            symbols.add("ContextStrategyConfig");
        }
        StringBuilder sb = new StringBuilder("from pipecat_flows import (\n");
        for (String symbol : symbols) {
            sb.append(INDENT).append(symbol).append(",\n");
        }
        return sb.append(")\n").toString();
    }

    /** Handler names referenced by {@code function} actions, in first-use order. */
    private static Set<String> actionHandlers(FlowDocument document) {
        Set<String> handlers = new LinkedHashSet<>();
        for (FlowNode node : document.getNodes()) {
            NodeData data = node.getData();
            List<FlowAction> actions = new ArrayList<>(data.getPreActions());
            actions.addAll(data.getPostActions());
            for (FlowAction action : actions) {
                if (FlowAction.TYPE_FUNCTION.equals(action.getType())
                        && action.getHandler() != null && !action.getHandler().isBlank()) {
                    handlers.add(Identifiers.toIdentifier(action.getHandler()));
                }
            }
        }
        return handlers;
    }

    private static void appendHandler(StringBuilder out, String handler, FlowFunction function, Names names) {
        out.append("async def ").append(handler)
                .append("(args: FlowArgs, flow_manager: FlowManager) -> tuple[FlowResult, NodeConfig | None]:\n");
        if (function.getDescription() != null && !function.getDescription().isBlank()) {
            out.append(INDENT).append("\"\"\"").append(escapeDocstring(function.getDescription())).append("\"\"\"\n");
        }
        out.append(INDENT).append("result: FlowResult = {\"status\": \"success\"}\n");
        if (function.hasDecision()) {
            appendDecision(out, function.getDecision(), names);
        } else {
            out.append(INDENT).append("return result, ").append(names.target(function.getNextNodeId())).append('\n');
        }
    }

    private static void appendDecision(StringBuilder out, Decision decision, Names names) {
        String action = decision.getAction();
        out.append(INDENT).append("value = ").append(action != null && !action.isBlank() ? indentContinuation(action) : "None").append('\n');
        String fallback = names.target(decision.getDefaultNextNodeId());
        if (decision.getConditions().isEmpty()) {
            out.append(INDENT).append("return result, ").append(fallback).append('\n');
            return;
        }
        for (int i = 0; i < decision.getConditions().size(); i++) {
            DecisionCondition condition = decision.getConditions().get(i);
            out.append(INDENT).append(i == 0 ? "if " : "elif ").append(test(condition)).append(":\n");
            out.append(INDENT).append(INDENT).append("return result, ")
                    .append(names.target(condition.getNextNodeId())).append('\n');
        }
        out.append(INDENT).append("else:\n");
        out.append(INDENT).append(INDENT).append("return result, ").append(fallback).append('\n');
    }

    /** The action as written; continuation lines move into the handler body. */
    private static String indentContinuation(String action) {
        return action.replace("\r\n", "\n").replace("\n", "\n" + INDENT);
    }

    private static String test(DecisionCondition condition) {
        ConditionOperator operator = condition.getOperator();
        if (operator == ConditionOperator.NOT) {
            return "not value";
        }
        String operand = operator.isMembership()
                ? PythonLiterals.membership(condition.getValue())
                : PythonLiterals.conditionValue(condition.getValue());
        return "value " + operator.getSymbol() + " " + operand;
    }

    private static void appendSchema(StringBuilder out, String handler, FlowFunction function) {
        out.append(handler).append("_schema = FlowsFunctionSchema(\n");
        out.append(INDENT).append("name=").append(PythonLiterals.string(function.getName())).append(",\n");
        out.append(INDENT).append("description=").append(PythonLiterals.string(
                function.getDescription() != null ? function.getDescription() : "")).append(",\n");
        out.append(INDENT).append("properties=").append(properties(function.getProperties())).append(",\n");
        List<String> required = new ArrayList<>();
        function.getRequired().forEach(r -> required.add(PythonLiterals.string(r)));
        out.append(INDENT).append("required=[").append(String.join(", ", required)).append("],\n");
        out.append(INDENT).append("handler=").append(handler).append(",\n");
        out.append(")\n");
    }

    private static String properties(Map<String, JsonNode> properties) {
        List<String> entries = new ArrayList<>(properties.size());
        properties.forEach((name, schema) -> entries.add(PythonLiterals.string(name) + ": " + PythonLiterals.json(schema)));
        return "{" + String.join(", ", entries) + "}";
    }

    private static void appendFactory(StringBuilder out, FlowNode node, List<String> schemas, Names names) {
        NodeData data = node.getData();
        String i2 = INDENT + INDENT;
        out.append("def ").append(names.factory(node.getId())).append("() -> NodeConfig:\n");
        out.append(INDENT).append("return NodeConfig(\n");
        out.append(i2).append("name=").append(PythonLiterals.string(node.getId())).append(",\n");
        if (!data.getRoleMessages().isEmpty()) {
            out.append(i2).append("role_messages=").append(messages(data.getRoleMessages())).append(",\n");
        }
        out.append(i2).append("task_messages=").append(messages(data.getTaskMessages())).append(",\n");
        out.append(i2).append("functions=[").append(String.join(", ", schemas)).append("],\n");
        if (!data.getPreActions().isEmpty()) {
            out.append(i2).append("pre_actions=").append(actions(data.getPreActions())).append(",\n");
        }
        if (!data.getPostActions().isEmpty()) {
            out.append(i2).append("post_actions=").append(actions(data.getPostActions())).append(",\n");
        }
        ContextStrategyConfig strategy = data.getContextStrategy();
        if (strategy != null) {
            out.append(i2).append("context_strategy=ContextStrategyConfig(strategy=ContextStrategy.")
                    .append(strategy.getStrategy().name());
            if (strategy.getSummaryPrompt() != null) {
                out.append(", summary_prompt=").append(PythonLiterals.string(strategy.getSummaryPrompt()));
            }
            out.append("),\n");
        }
        if (data.getRespondImmediately() != null) {
            out.append(i2).append("respond_immediately=")
                    .append(data.getRespondImmediately() ? "True" : "False").append(",\n");
        }
        out.append(INDENT).append(")\n");
    }

    private static String messages(List<FlowMessage> messages) {
        List<String> items = new ArrayList<>(messages.size());
        for (FlowMessage message : messages) {
            items.add("{\"role\": " + PythonLiterals.string(message.getRole().toValue())
                    + ", \"content\": " + PythonLiterals.string(message.getContent()) + "}");
        }
        return "[" + String.join(", ", items) + "]";
    }

    private static String actions(List<FlowAction> actions) {
        List<String> items = new ArrayList<>(actions.size());
        for (FlowAction action : actions) {
            List<String> entries = new ArrayList<>();
            entries.add("\"type\": " + PythonLiterals.string(action.getType()));
            if (action.getHandler() != null && !action.getHandler().isBlank()) {
                String handler = FlowAction.TYPE_FUNCTION.equals(action.getType())
                        ? Identifiers.toIdentifier(action.getHandler())
                        : PythonLiterals.string(action.getHandler());
                entries.add("\"handler\": " + handler);
            }
            if (action.getText() != null) {
                entries.add("\"text\": " + PythonLiterals.string(action.getText()));
            }
            action.getParams().forEach((k, v) -> entries.add(PythonLiterals.string(k) + ": " + PythonLiterals.json(v)));
            items.add("{" + String.join(", ", entries) + "}");
        }
        return "[" + String.join(", ", items) + "]";
    }

    private static String escapeDocstring(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /** Python names for one document, allocated once in document order. */
    private static final class Names {

        private final Map<String, String> factories = new LinkedHashMap<>();
        private final Map<String, String> handlers = new LinkedHashMap<>();

        static Names of(FlowDocument document) {
            Names names = new Names();
            PythonNames allocator = new PythonNames();
            allocator.allocate("create_initial_node");
            document.getNodes().forEach(node ->
                    names.factories.putIfAbsent(node.getId(), allocator.allocate("create_" + node.getId() + "_node")));
            for (FlowFunction function : document.getGlobalFunctions()) {
                names.handlers.put(globalKey(function), allocator.allocate("global_" + function.getName()));
            }
            for (FlowNode node : document.getNodes()) {
                for (FlowFunction function : node.getData().getFunctions()) {
                    names.handlers.putIfAbsent(key(node, function),
                            allocator.allocate(node.getId() + "_" + function.getName()));
                }
            }
            return names;
        }

        String factory(String nodeId) {
            return factories.get(nodeId);
        }

        String handler(FlowNode node, FlowFunction function) {
            return handlers.get(key(node, function));
        }

        String globalHandler(FlowFunction function) {
            return handlers.get(globalKey(function));
        }

        /** Constructor call for a routing target; unrouted or unknown targets end the node's routing. */
        String target(String nodeId) {
            if (nodeId == null || nodeId.isBlank()) return "None";
            String factory = factories.get(nodeId);
            return factory != null ? factory + "()" : "None";
        }

        private static String key(FlowNode node, FlowFunction function) {
            return node.getId() + "\u0000" + function.getName();
        }

        private static String globalKey(FlowFunction function) {
            return "\u0000global\u0000" + function.getName();
        }
    }
}
