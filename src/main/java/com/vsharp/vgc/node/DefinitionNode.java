package com.vsharp.vgc.node;

/**
 * A node that declares a reusable named construct (a type or a callable
 * signature) rather than emitting executable statements.
 *
 * Definition nodes have no statement-emission operation. They reach the
 * emitted unit through the definition registry, never through the scheduled
 * statement path.
 */
public abstract class DefinitionNode extends AbstractGraphNode {
    private final String name;

    protected DefinitionNode(String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Definition name must not be empty");
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String label() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
