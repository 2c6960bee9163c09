package com.convoflow.graph.decision;

import com.convoflow.schema.model.NodeKind;

import java.util.Optional;

/**
 * Ids of synthetic decision nodes: {@code decision:<sourceNodeId>:<functionName>}.
 * Function names cannot contain a colon, so the id is split at the last one.
 */
public final class DecisionNodeIds {

    public static final String PREFIX = NodeKind.DECISION_ID_PREFIX;

    private DecisionNodeIds() {
    }

    public static String of(String sourceNodeId, String functionName) {
        return PREFIX + sourceNodeId + ":" + functionName;
    }

    public static String of(DecisionKey key) {
        return of(key.getSourceNodeId(), key.getFunctionName());
    }

    public static boolean isDecisionId(String id) {
        return id != null && id.startsWith(PREFIX);
    }

    public static Optional<DecisionKey> parse(String id) {
        if (!isDecisionId(id)) return Optional.empty();
        String rest = id.substring(PREFIX.length());
        int sep = rest.lastIndexOf(':');
        if (sep <= 0 || sep == rest.length() - 1) return Optional.empty();
        return Optional.of(new DecisionKey(rest.substring(0, sep), rest.substring(sep + 1)));
    }
}
