package com.vsharp.vgc.node;

import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.ValueType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Signature metadata of a callable: name, static flag, return type, declaring
 * type and ordered parameters. Carries no body.
 */
public final class MethodDefinitionNode extends DefinitionNode {
    private final boolean isStatic;
    private final ValueType returnType;
    private final String declaringClass;
    private final List<Slot> parameters;

    public MethodDefinitionNode(String name, boolean isStatic, ValueType returnType,
            String declaringClass, List<Slot> parameters) {
        super(name);
        this.isStatic = isStatic;
        this.returnType = returnType;
        this.declaringClass = declaringClass;
        this.parameters = List.copyOf(parameters);
    }

    public boolean isStatic() {
        return isStatic;
    }

    public ValueType returnType() {
        return returnType;
    }

    public String declaringClass() {
        return declaringClass;
    }

    public List<Slot> parameters() {
        return parameters;
    }

    /** e.g. {@code public static int Point.scale(int factor)} */
    public String signature() {
        String params = parameters.stream()
                .map(p -> p.type().javaName() + " " + p.name())
                .collect(Collectors.joining(", "));
        return "public " + (isStatic ? "static " : "") + returnType.javaName() + " "
                + declaringClass + "." + name() + "(" + params + ")";
    }
}
