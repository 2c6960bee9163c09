package com.convoflow.codegen;

import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.model.FlowNode;
import com.convoflow.schema.validation.ValidationError;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowCompilerTest {

    private final FlowCompiler compiler = new FlowCompiler();

    @Test
    void compile_validDocumentProducesSource() {
        FlowDocument document = Fixtures.load("food_ordering.json");
        String code = compiler.compile(document);
        assertEquals(new PythonFlowGenerator().generate(document), code);
    }

    @Test
    void compile_refusesDanglingReferenceWithFirstError() {
        FlowDocument document = Fixtures.load("minimal.json");
        List<FlowNode> nodes = new ArrayList<>(document.getNodes());
        nodes.remove(1);
        FlowDocument broken = document.withNodes(nodes);

        CompileRefusedException e = assertThrows(CompileRefusedException.class, () -> compiler.compile(broken));
        ValidationError first = e.getFirstError();
        assertEquals(ValidationError.Category.SEMANTIC_GRAPH, first.getCategory());
        assertTrue(e.getMessage().contains("unknown node: end"), e.getMessage());
    }

    @Test
    void compile_refusesMissingInitialNode() {
        FlowDocument document = Fixtures.load("minimal.json");
        List<FlowNode> nodes = new ArrayList<>(document.getNodes());
        nodes.remove(0);

        CompileRefusedException e = assertThrows(CompileRefusedException.class,
                () -> compiler.compile(document.withNodes(nodes)));
        assertTrue(e.getMessage().contains("exactly one initial node"), e.getMessage());
    }
}
