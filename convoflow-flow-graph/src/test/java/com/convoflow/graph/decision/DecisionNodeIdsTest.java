package com.convoflow.graph.decision;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionNodeIdsTest {

    @Test
    void parse_splitsAtLastColon() {
        String id = DecisionNodeIds.of("ns:order", "check_size");

        DecisionKey key = DecisionNodeIds.parse(id).orElseThrow();

        assertEquals("decision:ns:order:check_size", id);
        assertEquals("ns:order", key.getSourceNodeId());
        assertEquals("check_size", key.getFunctionName());
    }

    @Test
    void parse_rejectsOtherIds() {
        assertFalse(DecisionNodeIds.parse("start").isPresent());
        assertFalse(DecisionNodeIds.parse("decision:").isPresent());
        assertFalse(DecisionNodeIds.parse("decision:onlynode").isPresent());
        assertTrue(DecisionNodeIds.isDecisionId("decision:a:b"));
    }
}
