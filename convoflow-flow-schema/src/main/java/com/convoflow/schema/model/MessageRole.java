package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Role of a role or task message. */
public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role is null");
        }
        return MessageRole.valueOf(value.trim().toUpperCase());
    }

    public static boolean isValid(String value) {
        if (value == null) return false;
        for (MessageRole r : values()) {
            if (r.toValue().equals(value)) return true;
        }
        return false;
    }
}
