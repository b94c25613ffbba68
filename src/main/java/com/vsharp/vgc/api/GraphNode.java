package com.vsharp.vgc.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node in the program graph.
 *
 * Every node, whether it declares a reusable construct or emits executable
 * statements, implements this interface.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every node has an opaque id that is unique within the process and
 * stable for the node's lifetime. Nodes refer to each other only through these
 * ids, never by holding references to one another.
 *
 * 2. Ports: An ordered list of input slots and an ordered list of output slots.
 * Slot names are unique among the inputs and, separately, among the outputs.
 *
 * 3. Bindings: A map from input slot name to the {@link SourceRef} of the
 * upstream output feeding it. Edges are derived from these bindings; there is
 * no separate edge list. An input has at most one producer, while one output
 * may feed any number of inputs.
 */
public interface GraphNode {

    /** Returns the process-unique identifier of this node. */
    String id();

    List<Slot> inputs();

    List<Slot> outputs();

    Optional<Slot> input(String name);

    Optional<Slot> output(String name);

    /**
     * Returns a read-only view of the recorded bindings, keyed by input slot
     * name, in binding order.
     */
    Map<String, SourceRef> connectedInputs();

    /**
     * Records the producer of an input. Last write wins; callers are expected to
     * go through the connector, which validates names and types first.
     *
     * @throws SlotNotFoundException if this node has no input with that name.
     */
    void bindInput(String inputName, SourceRef source);

    /**
     * Rewrites every slot of this node in the given generic group to the
     * concrete type. Slots outside the group are untouched.
     */
    void resolveGenericGroup(String group, ValueType type);

    /** Short human-readable label used in logs and error messages. */
    default String label() {
        return getClass().getSimpleName() + "[" + id() + "]";
    }
}
