package com.vsharp.vgc.node;

import com.vsharp.vgc.api.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declares a type: an ordered list of fields and the method signatures the
 * type exposes.
 *
 * The declaration is emitted through {@link #generateDefinitionCode(String)}
 * as a top-level class with one public mutable field per declared field.
 */
public final class ClassDefinitionNode extends DefinitionNode {
    private final List<FieldDefinition> fields = new ArrayList<>();
    private final List<MethodDefinitionNode> methods = new ArrayList<>();

    /** A declared field of a type definition. */
    public record FieldDefinition(String name, ValueType type) {
    }

    public ClassDefinitionNode(String name) {
        super(name);
    }

    public ClassDefinitionNode addField(String fieldName, ValueType type) {
        fields.add(new FieldDefinition(fieldName, type));
        return this;
    }

    public ClassDefinitionNode addMethod(MethodDefinitionNode method) {
        methods.add(method);
        return this;
    }

    public List<FieldDefinition> fields() {
        return Collections.unmodifiableList(fields);
    }

    public List<MethodDefinitionNode> methods() {
        return Collections.unmodifiableList(methods);
    }

    /**
     * Renders the type declaration.
     *
     * @param indent Indentation applied to each member line.
     */
    public String generateDefinitionCode(String indent) {
        StringBuilder sb = new StringBuilder(64 + fields.size() * 32);
        sb.append("class ").append(name()).append(" {\n");
        for (FieldDefinition f : fields) {
            sb.append(indent).append("public ").append(f.type().javaName())
                    .append(' ').append(f.name()).append(";\n");
        }
        return sb.append('}').toString();
    }
}
