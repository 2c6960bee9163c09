package com.convoflow.schema.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier rules shared by the editor and the code generator. Function and property names end up
 * as Python identifiers in generated code.
 */
public final class Identifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern FUNCTION_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private Identifiers() {
    }

    /** True if the value is an identifier ({@code [A-Za-z_][A-Za-z0-9_]*}). */
    public static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    /**
     * Formats free text as a function name: lowercase, runs of other characters collapsed to a single
     * underscore, no leading or trailing underscore, prefixed with {@code func_} when it starts with a digit.
     * Returns an empty string for blank input.
     */
    public static String formatFunctionName(String input) {
        if (input == null || input.isBlank()) return "";
        String formatted = input.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "_")
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_+|_+$", "");
        if (!formatted.isEmpty() && Character.isDigit(formatted.charAt(0))) {
            formatted = "func_" + formatted;
        }
        return formatted;
    }

    /**
     * Checks a function name typed in the editor.
     *
     * @return an error message, or null when the name is acceptable
     */
    public static String validateFunctionName(String name) {
        if (name == null || name.isBlank()) {
            return "Function name cannot be empty";
        }
        if (!FUNCTION_NAME.matcher(name.trim()).matches()) {
            return "Function name must start with a letter and contain only lowercase letters, numbers, and underscores";
        }
        return null;
    }

    public static String formatPropertyName(String input) {
        return formatFunctionName(input);
    }

    public static String validatePropertyName(String name) {
        return validateFunctionName(name);
    }

    /**
     * Turns an arbitrary id into a lowercase identifier fragment, e.g. {@code "Greeting-2"} to
     * {@code "greeting_2"}. Never returns an empty string.
     */
    public static String toIdentifier(String value) {
        String formatted = value == null ? "" : value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_+|_+$", "");
        if (formatted.isEmpty()) return "node";
        if (Character.isDigit(formatted.charAt(0))) return "n_" + formatted;
        return formatted;
    }
}
