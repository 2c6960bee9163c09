package com.convoflow.graph.edit;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/** A function property already used somewhere in the flow, offered when editing another function. */
public final class SuggestedProperty {

    private final String name;
    private final JsonNode schema;

    public SuggestedProperty(String name, JsonNode schema) {
        this.name = Objects.requireNonNull(name, "name");
        this.schema = schema;
    }

    public String getName() {
        return name;
    }

    /** Reduced schema: type, description, enum (as strings), minimum, maximum and pattern. */
    public JsonNode getSchema() {
        return schema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SuggestedProperty that = (SuggestedProperty) o;
        return name.equals(that.name) && Objects.equals(schema, that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, schema);
    }
}
