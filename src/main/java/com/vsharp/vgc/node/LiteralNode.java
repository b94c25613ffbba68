package com.vsharp.vgc.node;

import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.Symbol;
import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.engine.CodeGenContext;

import java.util.List;

/**
 * A constant value. Exposes one output slot, {@value #OUTPUT}, and emits a
 * single binding statement such as {@code int val0 = 7;}.
 */
public final class LiteralNode extends RuntimeNode {
    public static final String OUTPUT = "Value";
    private static final String DEFAULT_HINT = "val";

    private final ValueType type;
    private final Object value;
    private final String nameHint;

    public LiteralNode(ValueType type, Object value) {
        this(type, DEFAULT_HINT, value);
    }

    /**
     * @param type     Value type of the literal.
     * @param nameHint Prefix of the emitted symbol, e.g. "a" gives {@code a0};
     *                 see {@link Symbol#isValidHint(String)}.
     * @param value    The constant; must match the type (Object literals only
     *                 accept null).
     */
    public LiteralNode(ValueType type, String nameHint, Object value) {
        if (nameHint != null && !Symbol.isValidHint(nameHint))
            throw new IllegalArgumentException("Invalid name hint '" + nameHint
                    + "': must be a non-keyword identifier not ending in a digit");
        this.type = type;
        this.value = checkValue(type, value);
        this.nameHint = nameHint != null ? nameHint : DEFAULT_HINT;
        addOutput(new Slot(OUTPUT, type));
    }

    public ValueType type() {
        return type;
    }

    public Object value() {
        return value;
    }

    @Override
    public List<String> generateCode(CodeGenContext context) {
        Symbol symbol = context.allocator().allocate(type.hostType(), nameHint);
        context.registerOutput(this, OUTPUT, symbol);
        return List.of(type.javaName() + " " + symbol + " = " + render() + ";");
    }

    /** Java source spelling of the constant. */
    String render() {
        return switch (type) {
            case INT, BOOL -> String.valueOf(value);
            case FLOAT -> floatLiteral(((Number) value).floatValue());
            case STRING -> quote((String) value);
            default -> "null";
        };
    }

    private static Object checkValue(ValueType type, Object value) {
        boolean ok = switch (type) {
            case INT -> value instanceof Integer;
            case FLOAT -> value instanceof Float || value instanceof Double d && fitsFloat(d);
            case BOOL -> value instanceof Boolean;
            case STRING -> value instanceof String;
            case OBJECT -> value == null;
            case VOID, GENERIC_PLACEHOLDER -> false;
        };
        if (!ok)
            throw new IllegalArgumentException("Invalid " + type + " literal: " + value);
        return value;
    }

    /** NaN and infinities carry over; finite doubles must stay finite as floats. */
    private static boolean fitsFloat(double d) {
        return !Double.isFinite(d) || Math.abs(d) <= Float.MAX_VALUE;
    }

    private static String floatLiteral(float f) {
        if (Float.isNaN(f))
            return "Float.NaN";
        if (Float.isInfinite(f))
            return f > 0 ? "Float.POSITIVE_INFINITY" : "Float.NEGATIVE_INFINITY";
        return f + "f";
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20)
                        sb.append(String.format("\\u%04x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }
}
