package com.convoflow.schema.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating a flow document. Errors keep the order in which they were found.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<ValidationError> errors;

    private ValidationResult(boolean valid, List<ValidationError> errors) {
        this.valid = valid;
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(List<ValidationError> errors) {
        return new ValidationResult(false, errors != null ? errors : List.of());
    }

    public static ValidationResult failure(ValidationError singleError) {
        return new ValidationResult(false, List.of(Objects.requireNonNull(singleError, "singleError")));
    }

    /** Success when the list is empty, failure otherwise. */
    public static ValidationResult of(List<ValidationError> errors) {
        return errors == null || errors.isEmpty() ? success() : failure(errors);
    }

    public boolean isValid() {
        return valid;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /** First error, or null when valid. */
    public ValidationError firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
