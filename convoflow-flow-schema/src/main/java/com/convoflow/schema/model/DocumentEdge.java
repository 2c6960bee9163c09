package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Cached edge of a document. Routing metadata on functions is authoritative; this is rebuilt on export. */
public final class DocumentEdge {

    private final String id;
    private final String source;
    private final String target;
    private final String label;

    @JsonCreator
    public DocumentEdge(
            @JsonProperty("id") String id,
            @JsonProperty("source") String source,
            @JsonProperty("target") String target,
            @JsonProperty("label") String label) {
        this.id = id;
        this.source = source;
        this.target = target;
        this.label = label;
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentEdge that = (DocumentEdge) o;
        return Objects.equals(id, that.id) && Objects.equals(source, that.source)
                && Objects.equals(target, that.target) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, target, label);
    }
}
