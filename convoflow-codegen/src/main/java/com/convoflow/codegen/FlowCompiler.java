package com.convoflow.codegen;

import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.validation.FlowValidator;
import com.convoflow.schema.validation.ValidationResult;

/**
 * Validates a document with both passes and generates the Python scaffold. Never returns partial
 * output: an invalid document raises {@link CompileRefusedException}.
 */
public final class FlowCompiler {

    private final FlowValidator validator;
    private final PythonFlowGenerator generator;

    public FlowCompiler() {
        this(new FlowValidator(), new PythonFlowGenerator());
    }

    public FlowCompiler(FlowValidator validator, PythonFlowGenerator generator) {
        this.validator = validator;
        this.generator = generator;
    }

    public String compile(FlowDocument document) {
        ValidationResult result = validator.validate(document);
        if (!result.isValid()) {
            throw new CompileRefusedException(result);
        }
        return generator.generate(document);
    }
}
