package com.convoflow.graph.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable canvas state: nodes (including synthetic decision nodes), derived edges and the
 * document header. Updated by whole-value replacement only.
 */
public final class PresentationGraph {

    private final DocumentHeader header;
    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;

    public PresentationGraph(DocumentHeader header, List<GraphNode> nodes, List<GraphEdge> edges) {
        this.header = header != null ? header : DocumentHeader.EMPTY;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public DocumentHeader getHeader() {
        return header;
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    public Optional<GraphNode> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    public boolean containsNode(String id) {
        return findNode(id).isPresent();
    }

    public List<GraphNode> regularNodes() {
        return nodes.stream().filter(n -> !n.isDecision()).collect(Collectors.toList());
    }

    public List<GraphNode> decisionNodes() {
        return nodes.stream().filter(GraphNode::isDecision).collect(Collectors.toList());
    }

    public PresentationGraph withNodes(List<GraphNode> nodes) {
        return new PresentationGraph(header, nodes, edges);
    }

    public PresentationGraph withEdges(List<GraphEdge> edges) {
        return new PresentationGraph(header, nodes, edges);
    }

    public PresentationGraph withHeader(DocumentHeader header) {
        return new PresentationGraph(header, nodes, edges);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PresentationGraph that = (PresentationGraph) o;
        return header.equals(that.header) && nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, nodes, edges);
    }
}
