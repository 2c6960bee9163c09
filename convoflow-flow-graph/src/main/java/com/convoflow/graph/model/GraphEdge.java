package com.convoflow.graph.model;

import java.util.Objects;

/**
 * Derived presentation edge. Self loops carry their index among the node's self-loop functions
 * and a lateral offset so several loops on one node do not overlap; other edges have index -1
 * and offset 0.
 */
public final class GraphEdge {

    private final String id;
    private final String source;
    private final String target;
    private final String label;
    private final EdgeKind kind;
    private final int loopIndex;
    private final double lateralOffset;

    public GraphEdge(String id, String source, String target, String label, EdgeKind kind,
                     int loopIndex, double lateralOffset) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.label = label;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.loopIndex = loopIndex;
        this.lateralOffset = lateralOffset;
    }

    public static GraphEdge of(String id, String source, String target, String label, EdgeKind kind) {
        return new GraphEdge(id, source, target, label, kind, -1, 0);
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

    public EdgeKind getKind() {
        return kind;
    }

    public int getLoopIndex() {
        return loopIndex;
    }

    public double getLateralOffset() {
        return lateralOffset;
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphEdge that = (GraphEdge) o;
        return loopIndex == that.loopIndex && Double.compare(lateralOffset, that.lateralOffset) == 0
                && id.equals(that.id) && source.equals(that.source) && target.equals(that.target)
                && Objects.equals(label, that.label) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, target, label, kind, loopIndex, lateralOffset);
    }

    @Override
    public String toString() {
        return id + " (" + source + " -> " + target + ")";
    }
}
