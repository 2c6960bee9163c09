package com.convoflow.codegen;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Renders strings and JSON values as Python source literals. */
final class PythonLiterals {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private PythonLiterals() {
    }

    /** Double-quoted Python string. */
    static String string(String value) {
        if (value == null) return "None";
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /** JSON value as a Python literal: dicts, lists, True/False/None, numbers and strings. */
    static String json(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "None";
        if (node.isBoolean()) return node.booleanValue() ? "True" : "False";
        if (node.isNumber()) return node.asText();
        if (node.isTextual()) return string(node.textValue());
        if (node.isArray()) {
            List<String> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(json(item)));
            return "[" + String.join(", ", items) + "]";
        }
        List<String> entries = new ArrayList<>(node.size());
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            entries.add(string(e.getKey()) + ": " + json(e.getValue()));
        }
        return "{" + String.join(", ", entries) + "}";
    }

    /**
     * A condition value as typed in the editor: numbers and {@code True}/{@code False}/{@code None}
     * are emitted as they are, anything else as a string.
     */
    static String conditionValue(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (NUMBER.matcher(value).matches()) return value;
        if (value.equals("True") || value.equals("False") || value.equals("None")) return value;
        return string(value);
    }

    /**
     * Right-hand side of {@code in} / {@code not in}: a literal list or tuple is emitted verbatim,
     * otherwise the value is split at commas.
     */
    static String membership(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.startsWith("[") || value.startsWith("(")) return value;
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) items.add(conditionValue(part));
        }
        return "[" + String.join(", ", items) + "]";
    }
}
