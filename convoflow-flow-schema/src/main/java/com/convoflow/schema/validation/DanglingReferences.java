package com.convoflow.schema.validation;

import com.convoflow.schema.model.Decision;
import com.convoflow.schema.model.FlowFunction;
import com.convoflow.schema.model.FlowNode;
import com.convoflow.schema.model.NodeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds routing fields that name missing nodes. Decision nodes in the list are skipped as owners
 * and are not valid targets.
 */
public final class DanglingReferences {

    private DanglingReferences() {
    }

    public static List<DanglingReference> find(List<FlowNode> nodes) {
        Set<String> ids = new HashSet<>();
        for (FlowNode node : nodes) {
            if (node.getType() != NodeKind.DECISION) ids.add(node.getId());
        }
        List<DanglingReference> result = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (node.getType() == NodeKind.DECISION) continue;
            for (FlowFunction function : node.getData().getFunctions()) {
                Decision decision = function.getDecision();
                if (decision == null) {
                    check(ids, node, function, "next_node_id", function.getNextNodeId(), result);
                    continue;
                }
                for (int i = 0; i < decision.getConditions().size(); i++) {
                    check(ids, node, function, "conditions[" + i + "].next_node_id",
                            decision.getConditions().get(i).getNextNodeId(), result);
                }
                check(ids, node, function, "default_next_node_id", decision.getDefaultNextNodeId(), result);
            }
        }
        return result;
    }

    private static void check(Set<String> ids, FlowNode node, FlowFunction function, String field, String target,
                              List<DanglingReference> result) {
        if (target == null || target.isBlank() || ids.contains(target)) return;
        result.add(new DanglingReference(node.getId(), function.getName(), field, target));
    }
}
