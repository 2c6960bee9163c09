package com.convoflow.schema.validation;

import java.util.stream.Collectors;

/**
 * Thrown when a flow document fails validation and the caller asked for a blocking check.
 */
public final class FlowValidationException extends RuntimeException {

    private final ValidationResult result;

    public FlowValidationException(ValidationResult result) {
        super(buildMessage(result));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    private static String buildMessage(ValidationResult result) {
        if (result == null || result.getErrors().isEmpty()) {
            return "Flow document is invalid";
        }
        return "Flow document is invalid: " + result.getErrors().stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("; "));
    }
}
