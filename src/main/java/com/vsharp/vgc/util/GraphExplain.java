package com.vsharp.vgc.util;

import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.SourceRef;
import com.vsharp.vgc.engine.TopologicalOrder;
import com.vsharp.vgc.io.DefinitionRegistry;
import com.vsharp.vgc.node.ClassDefinitionNode;
import com.vsharp.vgc.node.DefinitionNode;
import com.vsharp.vgc.node.MethodDefinitionNode;

import java.util.List;

/**
 * Diagnostic utility for inspecting graph structure.
 *
 * <p>
 * Generates human-readable listings of the schedule, the slots and bindings of
 * each node, and the contents of a definition registry.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports.
 */
public final class GraphExplain {
    private final TopologicalOrder order;

    /**
     * @throws com.vsharp.vgc.api.CycleDetectedException if the nodes cannot be
     *                                                    scheduled.
     */
    public GraphExplain(List<? extends GraphNode> nodes) {
        this.order = TopologicalOrder.of(nodes);
    }

    /**
     * Dumps the slots and bindings of a single node.
     */
    public String explainNode(String nodeId) {
        int idx = order.topoIndex(nodeId);
        GraphNode node = order.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.label()).append('\n')
                .append("  Topo index: ").append(idx).append('\n');
        for (Slot in : node.inputs()) {
            SourceRef ref = node.connectedInputs().get(in.name());
            sb.append("  In  ").append(in);
            if (ref != null)
                sb.append(" <- ").append(order.node(order.topoIndex(ref.producerId())).label())
                        .append('.').append(ref.outputName());
            else
                sb.append(" (unbound)");
            sb.append('\n');
        }
        for (Slot out : node.outputs())
            sb.append("  Out ").append(out).append('\n');
        int cc = order.childCount(idx);
        sb.append("  Dependents (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(order.node(order.child(idx, i)).label());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /** Dumps every node in schedule order. */
    public String explainSchedule() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Schedule (").append(order.nodeCount()).append(" nodes)\n");
        for (int i = 0; i < order.nodeCount(); i++)
            sb.append(explainNode(order.node(i).id()));
        return sb.toString();
    }

    /** Lists the definitions of a registry with their fields and signatures. */
    public static String explainRegistry(DefinitionRegistry registry) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Definitions (").append(registry.size()).append(")\n");
        for (DefinitionNode def : registry.all()) {
            sb.append("  ").append(def.label()).append('\n');
            if (def instanceof ClassDefinitionNode cls) {
                for (var f : cls.fields())
                    sb.append("    field ").append(f.name()).append(": ").append(f.type()).append('\n');
                for (MethodDefinitionNode m : cls.methods())
                    sb.append("    ").append(m.signature()).append('\n');
            }
        }
        return sb.toString();
    }
}
