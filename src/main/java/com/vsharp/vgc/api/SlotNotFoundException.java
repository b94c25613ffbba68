package com.vsharp.vgc.api;

/**
 * Thrown when a connection names an input or output slot that does not exist
 * on the node it refers to.
 */
public class SlotNotFoundException extends IllegalArgumentException {
    private final String nodeId;
    private final String slotName;
    private final boolean input;

    public SlotNotFoundException(GraphNode node, String slotName, boolean input) {
        super((input ? "Input" : "Output") + " slot '" + slotName + "' not found on " + node.label());
        this.nodeId = node.id();
        this.slotName = slotName;
        this.input = input;
    }

    public String nodeId() {
        return nodeId;
    }

    public String slotName() {
        return slotName;
    }

    public boolean isInput() {
        return input;
    }
}
