package com.convoflow.graph.adapter;

import com.convoflow.config.EditorConfig;
import com.convoflow.graph.decision.DecisionNodeSynthesizer;
import com.convoflow.graph.edge.EdgeDeriver;
import com.convoflow.graph.model.DocumentHeader;
import com.convoflow.graph.model.GraphEdge;
import com.convoflow.graph.model.GraphNode;
import com.convoflow.graph.model.PresentationGraph;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the canonical document and the presentation graph.
 * <p>
 * {@code toDocument(toPresentation(doc))} equals {@code doc} whenever the document's edge cache
 * matches its routing; otherwise only the edge cache differs, since it is always rebuilt.
 * Both directions are total for documents that passed structural validation.
 */
public final class FlowAdapter {

    private final DecisionNodeSynthesizer synthesizer;

    public FlowAdapter() {
        this(EditorConfig.defaults());
    }

    public FlowAdapter(EditorConfig config) {
        this(new DecisionNodeSynthesizer(config));
    }

    public FlowAdapter(DecisionNodeSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /** Maps each document node 1:1, then adds decision nodes and derives edges. */
    public PresentationGraph toPresentation(FlowDocument document) {
        List<GraphNode> nodes = new ArrayList<>(document.getNodes().size());
        for (FlowNode node : document.getNodes()) {
            nodes.add(GraphNode.of(node));
        }
        List<GraphNode> reconciled = synthesizer.reconcile(nodes);
        return new PresentationGraph(DocumentHeader.from(document), reconciled, EdgeDeriver.derive(reconciled));
    }

    /** Drops decision nodes and derived edges; functions are written back as they are. */
    public FlowDocument toDocument(PresentationGraph graph) {
        List<FlowNode> nodes = new ArrayList<>();
        for (GraphNode node : graph.getNodes()) {
            if (!node.isDecision()) nodes.add(node.toFlowNode());
        }
        return graph.getHeader().toDocument(nodes, EdgeDeriver.deriveDocumentEdges(nodes));
    }

    /**
     * Reconciles decision nodes and recomputes edges after a node mutation.
     *
     * @return the same graph instance when neither nodes nor edges change
     */
    public PresentationGraph settle(PresentationGraph graph) {
        List<GraphNode> reconciled = synthesizer.reconcile(graph.getNodes());
        List<GraphEdge> edges = EdgeDeriver.derive(reconciled);
        boolean sameNodes = reconciled == graph.getNodes();
        boolean sameEdges = EdgeDeriver.sameEdges(graph.getEdges(), edges);
        if (sameNodes && sameEdges) {
            return graph;
        }
        PresentationGraph settled = sameNodes ? graph : graph.withNodes(reconciled);
        return sameEdges ? settled : settled.withEdges(edges);
    }

    public DecisionNodeSynthesizer getSynthesizer() {
        return synthesizer;
    }
}
