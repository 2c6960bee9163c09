package com.convoflow.graph.model;

/** How a presentation edge was derived. */
public enum EdgeKind {
    /** Plain {@code next_node_id} of a function; labelled with the function name. */
    FUNCTION,
    /** Unlabelled edge from a node to the decision node of one of its functions. */
    DECISION_ENTRY,
    /** Edge from a decision node to a condition target or the default target. */
    DECISION_BRANCH
}
