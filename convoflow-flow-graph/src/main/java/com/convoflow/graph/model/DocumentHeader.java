package com.convoflow.graph.model;

import com.convoflow.schema.model.DocumentEdge;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.FlowMeta;
import com.convoflow.schema.model.FlowNode;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Document-level fields that have no place on the canvas but must survive a round trip:
 * {@code $schema}, {@code $id}, meta, context and global functions.
 */
public final class DocumentHeader {

    public static final DocumentHeader EMPTY = new DocumentHeader(null, null, new FlowMeta("", null, null), null, List.of());

    private final String schemaUri;
    private final String documentId;
    private final FlowMeta meta;
    private final JsonNode context;
    private final List<FlowFunction> globalFunctions;

    public DocumentHeader(String schemaUri, String documentId, FlowMeta meta, JsonNode context,
                          List<FlowFunction> globalFunctions) {
        this.schemaUri = schemaUri;
        this.documentId = documentId;
        this.meta = meta;
        this.context = context != null ? context.deepCopy() : null;
        this.globalFunctions = globalFunctions != null ? List.copyOf(globalFunctions) : List.of();
    }

    public static DocumentHeader from(FlowDocument document) {
        return new DocumentHeader(document.getSchemaUri(), document.getDocumentId(), document.getMeta(),
                document.getContext(), document.getGlobalFunctions());
    }

    public String getSchemaUri() {
        return schemaUri;
    }

    public String getDocumentId() {
        return documentId;
    }

    public FlowMeta getMeta() {
        return meta;
    }

    public JsonNode getContext() {
        return context;
    }

    public List<FlowFunction> getGlobalFunctions() {
        return globalFunctions;
    }

    public DocumentHeader withMeta(FlowMeta meta) {
        return new DocumentHeader(schemaUri, documentId, meta, context, globalFunctions);
    }

    public FlowDocument toDocument(List<FlowNode> nodes, List<DocumentEdge> edges) {
        return new FlowDocument(schemaUri, documentId, meta, context, globalFunctions, nodes, edges);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentHeader that = (DocumentHeader) o;
        return Objects.equals(schemaUri, that.schemaUri) && Objects.equals(documentId, that.documentId)
                && Objects.equals(meta, that.meta) && Objects.equals(context, that.context)
                && Objects.equals(globalFunctions, that.globalFunctions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaUri, documentId, meta, context, globalFunctions);
    }
}
