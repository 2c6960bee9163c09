package com.convoflow.graph.edit;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NodeIdsTest {

    @Test
    void fromLabel_slugifiesAndDeduplicates() {
        assertEquals("order_pizza", NodeIds.fromLabel("Order Pizza!", Set.of()));
        assertEquals("order_pizza_3", NodeIds.fromLabel("Order Pizza", Set.of("order_pizza", "order_pizza_2")));
        assertEquals("node", NodeIds.fromLabel("  ", Set.of()));
        assertEquals("node_2", NodeIds.fromLabel(null, Set.of("node")));
    }

    @Test
    void copyLabels_countsExistingCopies() {
        assertEquals("Greeting copy", CopyLabels.next("Greeting", List.of("Greeting")));
        assertEquals("Greeting copy 2", CopyLabels.next("Greeting", List.of("Greeting", "Greeting copy")));
        assertEquals("Greeting copy 3", CopyLabels.next("Greeting copy", List.of("Greeting copy", "greeting copy 2")));
        assertEquals("Node copy", CopyLabels.next("", List.of()));
    }
}
