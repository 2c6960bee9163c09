package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** A role or task message of a node. */
public final class FlowMessage {

    private final MessageRole role;
    private final String content;

    @JsonCreator
    public FlowMessage(
            @JsonProperty("role") MessageRole role,
            @JsonProperty("content") String content) {
        this.role = role != null ? role : MessageRole.SYSTEM;
        this.content = content != null ? content : "";
    }

    public static FlowMessage system(String content) {
        return new FlowMessage(MessageRole.SYSTEM, content);
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowMessage that = (FlowMessage) o;
        return role == that.role && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content);
    }
}
