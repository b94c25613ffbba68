package com.vsharp.vgc.node;

import com.vsharp.vgc.api.ValueType;

/** Arithmetic operators a {@link BinaryOpNode} can apply. */
public enum BinaryOperator {
    ADD("+", "sum"),
    SUBTRACT("-", "diff"),
    MULTIPLY("*", "prod"),
    DIVIDE("/", "quot");

    private final String symbol;
    private final String nameHint;

    BinaryOperator(String symbol, String nameHint) {
        this.symbol = symbol;
        this.nameHint = nameHint;
    }

    public String symbol() {
        return symbol;
    }

    /** Prefix for the symbol holding the operator's result. */
    public String nameHint() {
        return nameHint;
    }

    /** Whether the operator is defined for operands of the given type. */
    public boolean supports(ValueType type) {
        return switch (type) {
            case INT, FLOAT -> true;
            case STRING -> this == ADD;
            default -> false;
        };
    }
}
