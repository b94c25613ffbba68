package com.vsharp.vgc.node;

import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.Symbol;
import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.engine.CodeGenContext;

import java.util.List;

/**
 * Applies an arithmetic operator to two inputs of one type and exposes the
 * result on an output of that same type.
 *
 * A generic variant places inputs and output in group {@value #GROUP}; the
 * concrete type is fixed by the generic resolver when the first concrete port
 * is connected.
 */
public final class BinaryOpNode extends RuntimeNode {
    public static final String LEFT = "A";
    public static final String RIGHT = "B";
    public static final String OUTPUT = "Result";
    public static final String GROUP = "T";

    private final BinaryOperator operator;

    public BinaryOpNode(BinaryOperator operator, ValueType type) {
        if (!operator.supports(type))
            throw new IllegalArgumentException(operator + " is not defined for " + type);
        this.operator = operator;
        addInput(new Slot(LEFT, type));
        addInput(new Slot(RIGHT, type));
        addOutput(new Slot(OUTPUT, type));
    }

    private BinaryOpNode(BinaryOperator operator) {
        this.operator = operator;
        addInput(Slot.generic(LEFT, GROUP));
        addInput(Slot.generic(RIGHT, GROUP));
        addOutput(Slot.generic(OUTPUT, GROUP));
    }

    /** Integer addition, the common case. */
    public static BinaryOpNode add() {
        return new BinaryOpNode(BinaryOperator.ADD, ValueType.INT);
    }

    public static BinaryOpNode generic(BinaryOperator operator) {
        return new BinaryOpNode(operator);
    }

    public BinaryOperator operator() {
        return operator;
    }

    @Override
    public List<String> generateCode(CodeGenContext context) {
        ValueType type = output(OUTPUT).orElseThrow().type();
        if (type == ValueType.GENERIC_PLACEHOLDER)
            throw new IllegalStateException("Unresolved generic group '" + GROUP + "' on " + label());
        if (!operator.supports(type))
            throw new IllegalStateException(operator + " is not defined for " + type + " on " + label());

        Symbol left = context.symbolFor(requireBinding(LEFT));
        Symbol right = context.symbolFor(requireBinding(RIGHT));
        Symbol result = context.allocator().allocate(type.hostType(), operator.nameHint());
        context.registerOutput(this, OUTPUT, result);
        return List.of(type.javaName() + " " + result + " = " + left + " " + operator.symbol() + " " + right + ";");
    }
}
