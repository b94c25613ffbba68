package com.vsharp.vgc.api;

/**
 * The closed vocabulary of value types a slot can carry.
 *
 * Each type knows how it is spelled in emitted Java source. Int, Float, Bool
 * and String map to their native equivalents; every other type (including an
 * unresolved generic placeholder) renders as {@code Object}.
 */
public enum ValueType {
    VOID("Object", Object.class),
    INT("int", Integer.class),
    FLOAT("float", Float.class),
    BOOL("boolean", Boolean.class),
    STRING("String", String.class),
    OBJECT("Object", Object.class),
    GENERIC_PLACEHOLDER("Object", Object.class);

    private final String javaName;
    private final Class<?> hostType;

    ValueType(String javaName, Class<?> hostType) {
        this.javaName = javaName;
        this.hostType = hostType;
    }

    /** Type name used in generated declarations. */
    public String javaName() {
        return javaName;
    }

    /** Boxed host class, used as the data kind of allocated symbols. */
    public Class<?> hostType() {
        return hostType;
    }

    /**
     * Infers a value type from a host type name as reported by reflection or
     * by an external metadata document. Only int, float, boolean and String
     * (primitive or boxed) are recognised; anything else is {@link #OBJECT}.
     */
    public static ValueType fromHostTypeName(String typeName) {
        if (typeName == null)
            return OBJECT;
        return switch (typeName) {
            case "int", "java.lang.Integer", "Integer" -> INT;
            case "float", "java.lang.Float", "Float" -> FLOAT;
            case "boolean", "java.lang.Boolean", "Boolean" -> BOOL;
            case "java.lang.String", "String" -> STRING;
            default -> OBJECT;
        };
    }

    public static ValueType fromHostType(Class<?> type) {
        return type == null ? OBJECT : fromHostTypeName(type.getName());
    }

    public static ValueType fromString(String text) {
        for (ValueType t : values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown ValueType: " + text);
    }
}
