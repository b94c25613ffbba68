package com.vsharp.vgc.api;

/**
 * A named, typed input or output port on a graph node.
 *
 * A slot with a non-null generic group takes part in generic resolution: all
 * slots of a node that share the group label must end up with one concrete
 * type. Once resolved the slot keeps its group label so later connections can
 * still be checked against the group.
 *
 * @param name         Port name, unique among a node's inputs (or outputs).
 * @param type         Current value type.
 * @param genericGroup Optional generic group label, null for monomorphic ports.
 */
public record Slot(String name, ValueType type, String genericGroup) {

    public Slot {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Slot name must not be empty");
        if (type == null)
            throw new IllegalArgumentException("Slot '" + name + "' needs a type");
    }

    public Slot(String name, ValueType type) {
        this(name, type, null);
    }

    /** Creates an unresolved generic slot in the given group. */
    public static Slot generic(String name, String group) {
        return new Slot(name, ValueType.GENERIC_PLACEHOLDER, group);
    }

    public boolean isGeneric() {
        return genericGroup != null;
    }

    /** True for a generic slot whose group has not been bound to a concrete type. */
    public boolean isUnresolved() {
        return type == ValueType.GENERIC_PLACEHOLDER;
    }

    public Slot withType(ValueType newType) {
        return new Slot(name, newType, genericGroup);
    }

    @Override
    public String toString() {
        return genericGroup == null ? name + ":" + type : name + ":" + type + "<" + genericGroup + ">";
    }
}
