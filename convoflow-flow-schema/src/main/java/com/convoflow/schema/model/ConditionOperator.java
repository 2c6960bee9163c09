package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operator of a decision condition. The symbol is what the document stores and
 * what the generated code uses. {@link #NOT} is unary: the condition value is ignored.
 */
public enum ConditionOperator {
    LT("<"),
    LTE("<="),
    EQ("=="),
    GTE(">="),
    GT(">"),
    NEQ("!="),
    NOT("not"),
    IN("in"),
    NOT_IN("not in");

    private final String symbol;

    ConditionOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    /** True for membership operators whose value is a collection. */
    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    @JsonCreator
    public static ConditionOperator fromSymbol(String symbol) {
        for (ConditionOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown condition operator: " + symbol);
    }

    public static boolean isValid(String symbol) {
        if (symbol == null) return false;
        for (ConditionOperator op : values()) {
            if (op.symbol.equals(symbol)) return true;
        }
        return false;
    }
}
