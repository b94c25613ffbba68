package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.SlotNotFoundException;
import com.vsharp.vgc.api.SourceRef;
import com.vsharp.vgc.api.TypeMismatchException;

import lombok.extern.log4j.Log4j2;

/**
 * Validates and records edges between node ports.
 *
 * An edge is stored only as a binding on the consumer; nothing else is
 * touched. Types must match exactly: there is no implicit coercion, and an
 * unresolved generic port only matches another unresolved generic port. Run
 * {@link GenericTypeResolver#unify} first to connect generic and concrete
 * ports.
 */
@Log4j2
public final class NodeConnector {

    private NodeConnector() {
        // Utility class
    }

    /**
     * Connects {@code fromNode.fromOutputName} to {@code toNode.toInputName}.
     * Reconnecting an input replaces its previous binding.
     *
     * @throws SlotNotFoundException if either slot does not exist.
     * @throws TypeMismatchException if the slot types differ; the consumer's
     *                               bindings are left unchanged.
     */
    public static void connect(GraphNode fromNode, String fromOutputName, GraphNode toNode, String toInputName) {
        Slot outSlot = fromNode.output(fromOutputName)
                .orElseThrow(() -> new SlotNotFoundException(fromNode, fromOutputName, false));
        Slot inSlot = toNode.input(toInputName)
                .orElseThrow(() -> new SlotNotFoundException(toNode, toInputName, true));
        if (outSlot.type() != inSlot.type())
            throw TypeMismatchException.forConnection(outSlot, inSlot);

        SourceRef previous = toNode.connectedInputs().get(toInputName);
        SourceRef ref = new SourceRef(fromNode.id(), fromOutputName);
        toNode.bindInput(toInputName, ref);
        if (previous != null && !previous.equals(ref))
            log.debug("Rebound {}.{}: {} -> {}", toNode.label(), toInputName, previous, ref);
    }
}
