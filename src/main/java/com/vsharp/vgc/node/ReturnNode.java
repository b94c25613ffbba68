package com.vsharp.vgc.node;

import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.Symbol;
import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.engine.CodeGenContext;

import java.util.List;

/**
 * Returns the value bound to its single input, {@value #INPUT}. Has no outputs.
 *
 * The code builder emits the return after all other statements, whatever its
 * position in the schedule.
 */
public final class ReturnNode extends RuntimeNode {
    public static final String INPUT = "Input";
    public static final String GROUP = "T";

    public ReturnNode(ValueType type) {
        addInput(new Slot(INPUT, type));
    }

    private ReturnNode() {
        addInput(Slot.generic(INPUT, GROUP));
    }

    /** A return whose input type is taken from whatever gets connected to it. */
    public static ReturnNode generic() {
        return new ReturnNode();
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public List<String> generateCode(CodeGenContext context) {
        Symbol value = context.symbolFor(requireBinding(INPUT));
        context.markReturnEmitted();
        return List.of("return " + value + ";");
    }
}
