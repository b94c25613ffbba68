package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.SlotNotFoundException;
import com.vsharp.vgc.api.TypeMismatchException;
import com.vsharp.vgc.api.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Resolves generic groups when generic ports are connected.
 *
 * Groups are node-local: all slots of one node that carry the same group label
 * must end up with one concrete type. Binding a group rewrites every slot in
 * it; binding it to a second, different type fails. The resolver never looks
 * past the two nodes of the connection, so a resolution does not ripple
 * through the rest of the graph.
 */
@Log4j2
public final class GenericTypeResolver {

    private GenericTypeResolver() {
        // Utility class
    }

    /**
     * Prepares a connection between a generic and a concrete port by binding
     * the generic side's group to the concrete type. Does nothing when both
     * sides are concrete or both are unresolved.
     *
     * @throws SlotNotFoundException if either slot does not exist.
     * @throws TypeMismatchException if the group is already bound to a
     *                               different type.
     */
    public static void unify(GraphNode fromNode, String fromOutputName, GraphNode toNode, String toInputName) {
        Slot outSlot = fromNode.output(fromOutputName)
                .orElseThrow(() -> new SlotNotFoundException(fromNode, fromOutputName, false));
        Slot inSlot = toNode.input(toInputName)
                .orElseThrow(() -> new SlotNotFoundException(toNode, toInputName, true));

        if (inSlot.isGeneric() && inSlot.isUnresolved() && !outSlot.isUnresolved())
            bindGroup(toNode, inSlot.genericGroup(), outSlot.type());
        else if (outSlot.isGeneric() && outSlot.isUnresolved() && !inSlot.isUnresolved())
            bindGroup(fromNode, outSlot.genericGroup(), inSlot.type());
    }

    /**
     * Applies a set of group resolutions to a node.
     *
     * @param resolved Concrete type per group label.
     * @throws TypeMismatchException on the first conflicting group; groups
     *                               applied before it stay applied.
     */
    public static void resolve(GraphNode node, Map<String, ValueType> resolved) {
        for (var entry : resolved.entrySet())
            bindGroup(node, entry.getKey(), entry.getValue());
    }

    /**
     * Binds one group of a node to a concrete type.
     *
     * @throws IllegalArgumentException if the type is itself a placeholder or
     *                                  the node has no slot in the group.
     * @throws TypeMismatchException    if a slot of the group already resolved
     *                                  to another type.
     */
    public static void bindGroup(GraphNode node, String group, ValueType type) {
        if (type == ValueType.GENERIC_PLACEHOLDER)
            throw new IllegalArgumentException("Cannot bind group '" + group + "' to a placeholder");

        List<Slot> members = new ArrayList<>();
        members.addAll(node.inputs());
        members.addAll(node.outputs());
        members.removeIf(s -> !group.equals(s.genericGroup()));
        if (members.isEmpty())
            throw new IllegalArgumentException("No generic group '" + group + "' on " + node.label());

        for (Slot s : members) {
            if (!s.isUnresolved() && s.type() != type)
                throw new TypeMismatchException("Generic group '" + group + "' on " + node.label()
                        + " is already " + s.type() + ", cannot bind to " + type, s.type(), type);
        }
        node.resolveGenericGroup(group, type);
        log.debug("Resolved group '{}' on {} to {}", group, node.label(), type);
    }
}
