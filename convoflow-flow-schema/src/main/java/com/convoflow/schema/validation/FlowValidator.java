package com.convoflow.schema.validation;

import com.convoflow.schema.FlowJson;
import com.convoflow.schema.model.FlowDocument;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Entry point for both validation passes. Import, save, export and compile call
 * {@link #validate(JsonNode)} or {@link #validateOrThrow(FlowDocument)}; live editing calls
 * {@link #validateGraph(FlowDocument)} and only shows the result.
 */
public final class FlowValidator {

    private final StructuralValidator structuralValidator;
    private final GraphValidator graphValidator;

    public FlowValidator() {
        this(new StructuralValidator(), new GraphValidator());
    }

    public FlowValidator(StructuralValidator structuralValidator, GraphValidator graphValidator) {
        this.structuralValidator = structuralValidator;
        this.graphValidator = graphValidator;
    }

    public ValidationResult validateStructure(JsonNode json) {
        return structuralValidator.validate(json);
    }

    public List<ValidationError> validateGraph(FlowDocument document) {
        return graphValidator.validate(document);
    }

    /**
     * Structural pass, then the graph pass on the bound document. The graph pass only runs when the
     * structural pass succeeds.
     */
    public ValidationResult validate(JsonNode json) {
        ValidationResult structural = validateStructure(json);
        if (!structural.isValid()) {
            return structural;
        }
        FlowDocument document;
        try {
            document = FlowJson.fromTree(json);
        } catch (UncheckedIOException e) {
            return ValidationResult.failure(ValidationError.structural("", "Document could not be read: "
                    + e.getCause().getMessage()));
        }
        return ValidationResult.of(validateGraph(document));
    }

    /** Both passes on an in-memory document. */
    public ValidationResult validate(FlowDocument document) {
        return validate(FlowJson.toTree(document));
    }

    /**
     * Validates and throws {@link FlowValidationException} if invalid.
     */
    public void validateOrThrow(FlowDocument document) {
        ValidationResult result = validate(document);
        if (!result.isValid()) {
            throw new FlowValidationException(result);
        }
    }
}
