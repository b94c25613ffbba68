package com.vsharp.vgc.io;

import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.node.ClassDefinitionNode;
import com.vsharp.vgc.node.MethodDefinitionNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Lifts external type metadata into definition nodes.
 *
 * Field, return and parameter types go through
 * {@link ValueType#fromHostTypeName(String)}: int, float, boolean and String
 * map to their value types, everything else to Object. Generic types are
 * skipped entirely. The resulting definition is registered under the type's
 * simple name, replacing any earlier one.
 */
@Log4j2
public final class ReflectionImporter {

    private ReflectionImporter() {
        // Utility class
    }

    /** Imports a loaded class. */
    public static Optional<ClassDefinitionNode> importType(Class<?> type, DefinitionRegistry registry) {
        return importType(TypeMetadata.fromClass(type), registry);
    }

    /**
     * Imports one type.
     *
     * @return The registered definition, or empty if the type was skipped.
     */
    public static Optional<ClassDefinitionNode> importType(TypeMetadata meta, DefinitionRegistry registry) {
        if (meta.isGeneric()) {
            log.debug("Skipping generic type {}", meta.getName());
            return Optional.empty();
        }

        var def = new ClassDefinitionNode(meta.getName());
        for (TypeMetadata.FieldInfo f : meta.getFields())
            def.addField(f.getName(), ValueType.fromHostTypeName(f.getType()));

        for (TypeMetadata.MethodInfo m : meta.getMethods()) {
            if (m.isSpecial())
                continue;
            List<Slot> params = new ArrayList<>(m.getParameters().size());
            for (TypeMetadata.ParameterInfo p : m.getParameters())
                params.add(new Slot(p.getName(), ValueType.fromHostTypeName(p.getType())));
            def.addMethod(new MethodDefinitionNode(m.getName(), m.isStaticMethod(),
                    ValueType.fromHostTypeName(m.getReturnType()), meta.getName(), params));
        }

        registry.register(def);
        log.debug("Imported {}: {} fields, {} methods", meta.getName(), def.fields().size(), def.methods().size());
        return Optional.of(def);
    }

    /** Imports several types, in order. Generic ones are skipped. */
    public static List<ClassDefinitionNode> importAll(List<TypeMetadata> types, DefinitionRegistry registry) {
        List<ClassDefinitionNode> imported = new ArrayList<>();
        for (TypeMetadata meta : types)
            importType(meta, registry).ifPresent(imported::add);
        return imported;
    }
}
