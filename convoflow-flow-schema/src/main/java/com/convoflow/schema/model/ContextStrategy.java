package com.convoflow.schema.model;

/** How the conversation context is carried into a node. */
public enum ContextStrategy {
    APPEND,
    RESET,
    /** Reset and seed the new context with a summary; requires a summary prompt. */
    RESET_WITH_SUMMARY;

    public static boolean isValid(String value) {
        if (value == null) return false;
        for (ContextStrategy s : values()) {
            if (s.name().equals(value)) return true;
        }
        return false;
    }
}
