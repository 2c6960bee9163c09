package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pre or post action of a node, e.g. {@code {"type": "tts_say", "text": "One moment"}} or
 * {@code {"type": "function", "handler": "log_order"}}. Fields other than type, handler and text are
 * kept in {@link #getParams()} and written back unchanged.
 */
public final class FlowAction {

    public static final String TYPE_FUNCTION = "function";
    public static final String TYPE_END_CONVERSATION = "end_conversation";
    public static final String TYPE_TTS_SAY = "tts_say";

    private final String type;
    private final String handler;
    private final String text;
    private final Map<String, JsonNode> params;

    @JsonCreator
    public FlowAction(
            @JsonProperty("type") String type,
            @JsonProperty("handler") String handler,
            @JsonProperty("text") String text) {
        this(type, handler, text, null);
    }

    public FlowAction(String type, String handler, String text, Map<String, JsonNode> params) {
        this.type = type;
        this.handler = handler;
        this.text = text;
        this.params = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((k, v) -> this.params.put(k, v != null ? v.deepCopy() : null));
        }
    }

    public String getType() {
        return type;
    }

    public String getHandler() {
        return handler;
    }

    public String getText() {
        return text;
    }

    /** Additional action fields, in document order. Unmodifiable. */
    @JsonAnyGetter
    public Map<String, JsonNode> getParams() {
        return Collections.unmodifiableMap(params);
    }

    @JsonAnySetter
    private void putParam(String name, JsonNode value) {
        params.put(name, value);
    }

    public FlowAction copy() {
        return new FlowAction(type, handler, text, params);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowAction that = (FlowAction) o;
        return Objects.equals(type, that.type) && Objects.equals(handler, that.handler)
                && Objects.equals(text, that.text) && Objects.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, handler, text, params);
    }
}
