package com.convoflow.schema.validation;

import com.convoflow.schema.model.ConditionOperator;
import com.convoflow.schema.model.ContextStrategy;
import com.convoflow.schema.model.MessageRole;
import com.convoflow.schema.model.NodeKind;
import com.convoflow.schema.util.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shape check of a raw flow document: required fields, value types and enum membership.
 * Does not look at ids or references; see {@link GraphValidator} for that.
 * Error paths are JSON pointers, e.g. {@code /nodes/0/data/functions/1/name}.
 */
public final class StructuralValidator {

    private static final Set<String> PROPERTY_TYPES =
            Set.of("string", "integer", "number", "boolean", "array", "object");

    public ValidationResult validate(JsonNode root) {
        List<ValidationError> errors = new ArrayList<>();
        if (root == null || !root.isObject()) {
            errors.add(ValidationError.structural("", "Document must be a JSON object"));
            return ValidationResult.failure(errors);
        }

        optionalString(root, "$schema", "", errors);
        optionalString(root, "$id", "", errors);

        JsonNode meta = root.get("meta");
        if (meta == null || !meta.isObject()) {
            errors.add(ValidationError.structural("/meta", "meta is required and must be an object"));
        } else {
            requiredString(meta, "name", "/meta", errors);
            optionalString(meta, "version", "/meta", errors);
            optionalString(meta, "description", "/meta", errors);
        }

        JsonNode context = root.get("context");
        if (context != null && !context.isNull() && !context.isObject()) {
            errors.add(ValidationError.structural("/context", "context must be an object"));
        }

        JsonNode globals = root.get("global_functions");
        if (present(globals)) {
            if (!globals.isArray()) {
                errors.add(ValidationError.structural("/global_functions", "global_functions must be an array"));
            } else {
                for (int i = 0; i < globals.size(); i++) {
                    validateFunction(globals.get(i), "/global_functions/" + i, errors);
                }
            }
        }

        JsonNode nodes = root.get("nodes");
        if (nodes == null || !nodes.isArray()) {
            errors.add(ValidationError.structural("/nodes", "nodes is required and must be an array"));
        } else {
            for (int i = 0; i < nodes.size(); i++) {
                validateNode(nodes.get(i), "/nodes/" + i, errors);
            }
        }

        JsonNode edges = root.get("edges");
        if (present(edges)) {
            if (!edges.isArray()) {
                errors.add(ValidationError.structural("/edges", "edges must be an array"));
            } else {
                for (int i = 0; i < edges.size(); i++) {
                    validateEdge(edges.get(i), "/edges/" + i, errors);
                }
            }
        }

        return ValidationResult.of(errors);
    }

    private void validateNode(JsonNode node, String path, List<ValidationError> errors) {
        if (!node.isObject()) {
            errors.add(ValidationError.structural(path, "node must be an object"));
            return;
        }
        requiredString(node, "id", path, errors);
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            errors.add(ValidationError.structural(path + "/type", "type is required and must be a string"));
        } else if (!NodeKind.isDocumentValue(type.asText())) {
            errors.add(ValidationError.structural(path + "/type",
                    "type must be one of initial, node, end (was '" + type.asText() + "')"));
        }
        validatePosition(node.get("position"), path + "/position", true, errors);

        JsonNode data = node.get("data");
        if (data == null || !data.isObject()) {
            errors.add(ValidationError.structural(path + "/data", "data is required and must be an object"));
            return;
        }
        optionalString(data, "label", path + "/data", errors);
        validateMessages(data.get("role_messages"), path + "/data/role_messages", errors);
        validateMessages(data.get("task_messages"), path + "/data/task_messages", errors);
        validateActions(data.get("pre_actions"), path + "/data/pre_actions", errors);
        validateActions(data.get("post_actions"), path + "/data/post_actions", errors);

        JsonNode functions = data.get("functions");
        if (present(functions)) {
            if (!functions.isArray()) {
                errors.add(ValidationError.structural(path + "/data/functions", "functions must be an array"));
            } else {
                for (int i = 0; i < functions.size(); i++) {
                    validateFunction(functions.get(i), path + "/data/functions/" + i, errors);
                }
            }
        }

        validateContextStrategy(data.get("context_strategy"), path + "/data/context_strategy", errors);

        JsonNode respond = data.get("respond_immediately");
        if (present(respond) && !respond.isBoolean()) {
            errors.add(ValidationError.structural(path + "/data/respond_immediately",
                    "respond_immediately must be a boolean"));
        }
    }

    private void validateMessages(JsonNode messages, String path, List<ValidationError> errors) {
        if (!present(messages)) return;
        if (!messages.isArray()) {
            errors.add(ValidationError.structural(path, "messages must be an array"));
            return;
        }
        for (int i = 0; i < messages.size(); i++) {
            JsonNode message = messages.get(i);
            String itemPath = path + "/" + i;
            if (!message.isObject()) {
                errors.add(ValidationError.structural(itemPath, "message must be an object"));
                continue;
            }
            JsonNode role = message.get("role");
            if (role == null || !role.isTextual()) {
                errors.add(ValidationError.structural(itemPath + "/role", "role is required and must be a string"));
            } else if (!MessageRole.isValid(role.asText())) {
                errors.add(ValidationError.structural(itemPath + "/role",
                        "role must be one of system, user, assistant (was '" + role.asText() + "')"));
            }
            requiredString(message, "content", itemPath, errors);
        }
    }

    private void validateActions(JsonNode actions, String path, List<ValidationError> errors) {
        if (!present(actions)) return;
        if (!actions.isArray()) {
            errors.add(ValidationError.structural(path, "actions must be an array"));
            return;
        }
        for (int i = 0; i < actions.size(); i++) {
            JsonNode action = actions.get(i);
            String itemPath = path + "/" + i;
            if (!action.isObject()) {
                errors.add(ValidationError.structural(itemPath, "action must be an object"));
                continue;
            }
            requiredString(action, "type", itemPath, errors);
            optionalString(action, "handler", itemPath, errors);
            optionalString(action, "text", itemPath, errors);
        }
    }

    private void validateFunction(JsonNode function, String path, List<ValidationError> errors) {
        if (!function.isObject()) {
            errors.add(ValidationError.structural(path, "function must be an object"));
            return;
        }
        JsonNode name = function.get("name");
        if (name == null || !name.isTextual()) {
            errors.add(ValidationError.structural(path + "/name", "name is required and must be a string"));
        } else if (!Identifiers.isIdentifier(name.asText())) {
            errors.add(ValidationError.structural(path + "/name",
                    "name must be a valid identifier (was '" + name.asText() + "')"));
        }
        requiredString(function, "description", path, errors);

        JsonNode properties = function.get("properties");
        if (present(properties)) {
            if (!properties.isObject()) {
                errors.add(ValidationError.structural(path + "/properties", "properties must be an object"));
            } else {
                Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    validateProperty(e.getValue(), path + "/properties/" + e.getKey(), errors);
                }
            }
        }

        JsonNode required = function.get("required");
        if (present(required)) {
            if (!required.isArray()) {
                errors.add(ValidationError.structural(path + "/required", "required must be an array"));
            } else {
                for (int i = 0; i < required.size(); i++) {
                    if (!required.get(i).isTextual()) {
                        errors.add(ValidationError.structural(path + "/required/" + i, "required entry must be a string"));
                    }
                }
            }
        }

        optionalString(function, "next_node_id", path, errors);
        JsonNode decision = function.get("decision");
        if (present(decision)) {
            validateDecision(decision, path + "/decision", errors);
        }
    }

    private void validateProperty(JsonNode property, String path, List<ValidationError> errors) {
        if (!property.isObject()) {
            errors.add(ValidationError.structural(path, "property schema must be an object"));
            return;
        }
        JsonNode type = property.get("type");
        if (!present(type)) return;
        if (!type.isTextual() || !PROPERTY_TYPES.contains(type.asText())) {
            errors.add(ValidationError.structural(path + "/type",
                    "type must be one of string, integer, number, boolean, array, object (was " + type + ")"));
        }
    }

    private void validateDecision(JsonNode decision, String path, List<ValidationError> errors) {
        if (!decision.isObject()) {
            errors.add(ValidationError.structural(path, "decision must be an object"));
            return;
        }
        requiredString(decision, "action", path, errors);
        requiredString(decision, "default_next_node_id", path, errors);
        validatePosition(decision.get("decision_node_position"), path + "/decision_node_position", false, errors);

        JsonNode conditions = decision.get("conditions");
        if (conditions == null || !conditions.isArray()) {
            errors.add(ValidationError.structural(path + "/conditions", "conditions is required and must be an array"));
            return;
        }
        for (int i = 0; i < conditions.size(); i++) {
            JsonNode condition = conditions.get(i);
            String itemPath = path + "/conditions/" + i;
            if (!condition.isObject()) {
                errors.add(ValidationError.structural(itemPath, "condition must be an object"));
                continue;
            }
            JsonNode operator = condition.get("operator");
            if (operator == null || !operator.isTextual()) {
                errors.add(ValidationError.structural(itemPath + "/operator", "operator is required and must be a string"));
            } else if (!ConditionOperator.isValid(operator.asText())) {
                errors.add(ValidationError.structural(itemPath + "/operator",
                        "operator must be one of <, <=, ==, >=, >, !=, not, in, not in (was '" + operator.asText() + "')"));
            }
            requiredString(condition, "value", itemPath, errors);
            requiredString(condition, "next_node_id", itemPath, errors);
        }
    }

    private void validateContextStrategy(JsonNode config, String path, List<ValidationError> errors) {
        if (!present(config)) return;
        if (!config.isObject()) {
            errors.add(ValidationError.structural(path, "context_strategy must be an object"));
            return;
        }
        JsonNode strategy = config.get("strategy");
        if (strategy == null || !strategy.isTextual()) {
            errors.add(ValidationError.structural(path + "/strategy", "strategy is required and must be a string"));
            return;
        }
        if (!ContextStrategy.isValid(strategy.asText())) {
            errors.add(ValidationError.structural(path + "/strategy",
                    "strategy must be one of APPEND, RESET, RESET_WITH_SUMMARY (was '" + strategy.asText() + "')"));
            return;
        }
        optionalString(config, "summary_prompt", path, errors);
        if (ContextStrategy.RESET_WITH_SUMMARY.name().equals(strategy.asText())) {
            JsonNode prompt = config.get("summary_prompt");
            if (prompt == null || !prompt.isTextual() || prompt.asText().isBlank()) {
                errors.add(ValidationError.structural(path + "/summary_prompt",
                        "summary_prompt is required for RESET_WITH_SUMMARY"));
            }
        }
    }

    private void validatePosition(JsonNode position, String path, boolean required, List<ValidationError> errors) {
        if (!present(position)) {
            if (required) errors.add(ValidationError.structural(path, "position is required"));
            return;
        }
        if (!position.isObject()) {
            errors.add(ValidationError.structural(path, "position must be an object"));
            return;
        }
        for (String axis : List.of("x", "y")) {
            JsonNode v = position.get(axis);
            if (v == null || !v.isNumber()) {
                errors.add(ValidationError.structural(path + "/" + axis, axis + " is required and must be a number"));
            }
        }
    }

    private void validateEdge(JsonNode edge, String path, List<ValidationError> errors) {
        if (!edge.isObject()) {
            errors.add(ValidationError.structural(path, "edge must be an object"));
            return;
        }
        requiredString(edge, "id", path, errors);
        requiredString(edge, "source", path, errors);
        requiredString(edge, "target", path, errors);
        optionalString(edge, "label", path, errors);
    }

    private static boolean present(JsonNode value) {
        return value != null && !value.isNull();
    }

    private static void requiredString(JsonNode parent, String field, String path, List<ValidationError> errors) {
        JsonNode v = parent.get(field);
        if (v == null || !v.isTextual()) {
            errors.add(ValidationError.structural(path + "/" + field, field + " is required and must be a string"));
        }
    }

    private static void optionalString(JsonNode parent, String field, String path, List<ValidationError> errors) {
        JsonNode v = parent.get(field);
        if (present(v) && !v.isTextual()) {
            errors.add(ValidationError.structural(path + "/" + field, field + " must be a string"));
        }
    }
}
