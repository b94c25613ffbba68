package com.vsharp.vgc.io;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * Description of an external type as seen by the importer: its public instance
 * fields and public methods, with host types given by name ({@code int},
 * {@code java.lang.String}, ...).
 *
 * Instances come either from reflection ({@link #fromClass(Class)}) or from a
 * JSON document ({@link TypeMetadataReader}).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class TypeMetadata {
    private String name;
    private boolean generic;
    private List<FieldInfo> fields = new ArrayList<>();
    private List<MethodInfo> methods = new ArrayList<>();

    /** A public instance field. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FieldInfo {
        private String name, type;
    }

    /** A public method. Special members are reported but not imported. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class MethodInfo {
        private String name, returnType;
        @JsonProperty("static")
        private boolean staticMethod;
        private boolean special;
        private List<ParameterInfo> parameters = new ArrayList<>();
    }

    /** A method parameter. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ParameterInfo {
        private String name, type;
    }

    /**
     * Reads metadata from a loaded class.
     *
     * Fields: public, non-static. Methods: public, static or instance, excluding
     * those declared by {@code java.lang.Object}. Synthetic and bridge methods
     * are reported with {@code special = true}.
     */
    public static TypeMetadata fromClass(Class<?> type) {
        TypeMetadata meta = new TypeMetadata();
        meta.setName(type.getSimpleName());
        meta.setGeneric(type.getTypeParameters().length > 0);

        for (Field f : type.getFields()) {
            if (Modifier.isStatic(f.getModifiers()))
                continue;
            FieldInfo fi = new FieldInfo();
            fi.setName(f.getName());
            fi.setType(f.getType().getName());
            meta.getFields().add(fi);
        }

        for (Method m : type.getMethods()) {
            if (m.getDeclaringClass() == Object.class)
                continue;
            MethodInfo mi = new MethodInfo();
            mi.setName(m.getName());
            mi.setReturnType(m.getReturnType().getName());
            mi.setStaticMethod(Modifier.isStatic(m.getModifiers()));
            mi.setSpecial(m.isSynthetic() || m.isBridge());
            for (Parameter p : m.getParameters()) {
                ParameterInfo pi = new ParameterInfo();
                pi.setName(p.getName());
                pi.setType(p.getType().getName());
                mi.getParameters().add(pi);
            }
            meta.getMethods().add(mi);
        }
        return meta;
    }
}
