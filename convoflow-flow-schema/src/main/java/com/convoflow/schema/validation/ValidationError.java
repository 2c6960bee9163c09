package com.convoflow.schema.validation;

import java.util.Objects;

/**
 * A single validation finding. Structural errors carry the JSON path of the offending value;
 * graph errors have a null path.
 */
public final class ValidationError {

    public enum Category {
        /** Shape violation; always fatal to the operation that asked for validation. */
        STRUCTURAL,
        /** Duplicate id or dangling reference; fatal for compile and export, advisory while editing. */
        SEMANTIC_GRAPH
    }

    private final Category category;
    private final String path;
    private final String message;

    private ValidationError(Category category, String path, String message) {
        this.category = Objects.requireNonNull(category, "category");
        this.path = path;
        this.message = Objects.requireNonNull(message, "message");
    }

    public static ValidationError structural(String path, String message) {
        return new ValidationError(Category.STRUCTURAL, path, message);
    }

    public static ValidationError graph(String message) {
        return new ValidationError(Category.SEMANTIC_GRAPH, null, message);
    }

    public Category getCategory() {
        return category;
    }

    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationError that = (ValidationError) o;
        return category == that.category && Objects.equals(path, that.path) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, path, message);
    }

    @Override
    public String toString() {
        return path != null ? path + ": " + message : message;
    }
}
