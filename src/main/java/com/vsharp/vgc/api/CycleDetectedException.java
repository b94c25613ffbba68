package com.vsharp.vgc.api;

import java.util.List;

/**
 * Thrown by the scheduler when the node set has no total order. Carries the ids
 * of the nodes that could not be scheduled.
 */
public class CycleDetectedException extends IllegalStateException {
    private final List<String> unresolvedIds;

    public CycleDetectedException(int processed, int total, List<String> unresolvedIds) {
        super("Cycle detected! Processed " + processed + " of " + total
                + ". Unresolved nodes: " + String.join(", ", unresolvedIds));
        this.unresolvedIds = List.copyOf(unresolvedIds);
    }

    public List<String> unresolvedIds() {
        return unresolvedIds;
    }
}
