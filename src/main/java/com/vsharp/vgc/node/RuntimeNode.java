package com.vsharp.vgc.node;

import com.vsharp.vgc.engine.CodeGenContext;

import java.util.List;

/**
 * A node that emits executable statements when visited by the code builder.
 *
 * Contract for {@link #generateCode(CodeGenContext)}:
 * <ul>
 * <li>Producer symbols are looked up in the context by the {@code SourceRef}
 * recorded on each connected input.</li>
 * <li>Every value the node produces gets a freshly allocated symbol, registered
 * in the context against this node's id and output slot name.</li>
 * <li>The returned lines are statements in emission order.</li>
 * </ul>
 * The builder calls this method at most once per node and build, after every
 * producer the node depends on has been emitted.
 */
public abstract class RuntimeNode extends AbstractGraphNode {

    public abstract List<String> generateCode(CodeGenContext context);

    /**
     * True if the node ends the entry point. Terminal nodes are emitted after
     * every other runtime node, and a graph may hold at most one.
     */
    public boolean isTerminal() {
        return false;
    }
}
