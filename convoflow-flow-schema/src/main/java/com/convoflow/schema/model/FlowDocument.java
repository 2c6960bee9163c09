package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical flow document. {@code $schema} and {@code $id} are carried through unchanged;
 * {@code edges} is a cache derived from function routing.
 */
@JsonPropertyOrder({"$schema", "$id", "meta", "context", "global_functions", "nodes", "edges"})
public final class FlowDocument {

    private final String schemaUri;
    private final String documentId;
    private final FlowMeta meta;
    private final JsonNode context;
    private final List<FlowFunction> globalFunctions;
    private final List<FlowNode> nodes;
    private final List<DocumentEdge> edges;

    @JsonCreator
    public FlowDocument(
            @JsonProperty("$schema") String schemaUri,
            @JsonProperty("$id") String documentId,
            @JsonProperty("meta") FlowMeta meta,
            @JsonProperty("context") JsonNode context,
            @JsonProperty("global_functions") List<FlowFunction> globalFunctions,
            @JsonProperty("nodes") List<FlowNode> nodes,
            @JsonProperty("edges") List<DocumentEdge> edges) {
        this.schemaUri = schemaUri;
        this.documentId = documentId;
        this.meta = meta != null ? meta : new FlowMeta("", null, null);
        this.context = context != null ? context.deepCopy() : null;
        this.globalFunctions = globalFunctions != null ? List.copyOf(globalFunctions) : List.of();
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
    }

    @JsonProperty("$schema")
    public String getSchemaUri() {
        return schemaUri;
    }

    @JsonProperty("$id")
    public String getDocumentId() {
        return documentId;
    }

    public FlowMeta getMeta() {
        return meta;
    }

    public JsonNode getContext() {
        return context;
    }

    @JsonProperty("global_functions")
    public List<FlowFunction> getGlobalFunctions() {
        return globalFunctions;
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public List<DocumentEdge> getEdges() {
        return edges;
    }

    public Optional<FlowNode> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    /** The first node of kind initial, if any. */
    @JsonIgnore
    public Optional<FlowNode> getInitialNode() {
        return nodes.stream().filter(n -> n.getType() == NodeKind.INITIAL).findFirst();
    }

    public FlowDocument withNodes(List<FlowNode> nodes) {
        return new FlowDocument(schemaUri, documentId, meta, context, globalFunctions, nodes, edges);
    }

    public FlowDocument withEdges(List<DocumentEdge> edges) {
        return new FlowDocument(schemaUri, documentId, meta, context, globalFunctions, nodes, edges);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowDocument that = (FlowDocument) o;
        return Objects.equals(schemaUri, that.schemaUri) && Objects.equals(documentId, that.documentId)
                && Objects.equals(meta, that.meta) && Objects.equals(context, that.context)
                && Objects.equals(globalFunctions, that.globalFunctions)
                && Objects.equals(nodes, that.nodes) && Objects.equals(edges, that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaUri, documentId, meta, context, globalFunctions, nodes, edges);
    }
}
