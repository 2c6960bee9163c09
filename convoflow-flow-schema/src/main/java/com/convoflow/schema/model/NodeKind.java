package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a flow node. Documents use {@code initial}, {@code node} (alias {@code step}) and {@code end};
 * {@link #DECISION} exists only in the presentation graph.
 */
public enum NodeKind {
    INITIAL("initial"),
    STEP("node"),
    END("end"),
    /** Synthetic node mirroring a function's decision block; never persisted. */
    DECISION("decision");

    /** Id prefix reserved for synthetic decision nodes; document nodes may not use it. */
    public static final String DECISION_ID_PREFIX = "decision:";

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** True if {@code spelling} names this kind, including the {@code step} alias. */
    public boolean isSpelledAs(String spelling) {
        if (spelling == null) return false;
        String normalized = spelling.trim().toLowerCase();
        return value.equals(normalized) || (this == STEP && "step".equals(normalized));
    }

    /** Kinds allowed in a persisted document. */
    public boolean isDocumentKind() {
        return this != DECISION;
    }

    @JsonCreator
    public static NodeKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node type is null");
        }
        String normalized = value.trim().toLowerCase();
        if ("step".equals(normalized)) return STEP;
        for (NodeKind k : values()) {
            if (k.value.equals(normalized)) return k;
        }
        throw new IllegalArgumentException("Unknown node type: " + value);
    }

    /** Returns true if the string is a kind accepted in a document (initial, node, step, end). */
    public static boolean isDocumentValue(String value) {
        if (value == null) return false;
        return switch (value) {
            case "initial", "node", "step", "end" -> true;
            default -> false;
        };
    }
}
