package com.convoflow.codegen;

import com.convoflow.schema.validation.ValidationError;
import com.convoflow.schema.validation.ValidationResult;

/**
 * Thrown instead of generating code for a document that fails validation. Carries the first error.
 */
public final class CompileRefusedException extends RuntimeException {

    private final ValidationResult result;

    public CompileRefusedException(ValidationResult result) {
        super("Cannot compile flow: " + describe(result.firstError()));
        this.result = result;
    }

    public ValidationError getFirstError() {
        return result.firstError();
    }

    public ValidationResult getResult() {
        return result;
    }

    private static String describe(ValidationError error) {
        return error != null ? error.toString() : "document is invalid";
    }
}
