package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Flow name, version and description. */
public final class FlowMeta {

    private final String name;
    private final String version;
    private final String description;

    @JsonCreator
    public FlowMeta(
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("description") String description) {
        this.name = name != null ? name : "";
        this.version = version;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowMeta that = (FlowMeta) o;
        return Objects.equals(name, that.name) && Objects.equals(version, that.version)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, description);
    }
}
