package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.SourceRef;
import com.vsharp.vgc.api.Symbol;
import com.vsharp.vgc.io.DefinitionRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one build session.
 *
 * Holds the required imports, the symbol allocator, the symbols produced by
 * each emitted node output and a handle to the definition registry. Create a
 * fresh context for every build; it is not safe to share between builds or
 * threads.
 *
 * Produced symbols are keyed by the full (producer id, output slot) pair, so a
 * node with several outputs can publish a symbol per output.
 */
public final class CodeGenContext {
    private final Set<String> imports = new LinkedHashSet<>();
    private final SymbolAllocator allocator = new SymbolAllocator();
    private final Map<SourceRef, Symbol> nodeOutputs = new HashMap<>();
    private final List<String> statements = new ArrayList<>();
    private final DefinitionRegistry registry;
    private boolean returnEmitted;

    public CodeGenContext() {
        this(new DefinitionRegistry());
    }

    public CodeGenContext(DefinitionRegistry registry) {
        this.registry = registry;
    }

    public void addImport(String name) {
        imports.add(name);
    }

    /** Required imports in insertion order. */
    public Set<String> imports() {
        return Collections.unmodifiableSet(imports);
    }

    public SymbolAllocator allocator() {
        return allocator;
    }

    public DefinitionRegistry registry() {
        return registry;
    }

    /** Publishes the symbol holding the value of one of a node's outputs. */
    public void registerOutput(GraphNode node, String outputName, Symbol symbol) {
        if (node.output(outputName).isEmpty())
            throw new IllegalArgumentException("No output '" + outputName + "' on " + node.label());
        nodeOutputs.put(new SourceRef(node.id(), outputName), symbol);
    }

    /**
     * Looks up the symbol an upstream output was bound to.
     *
     * @throws IllegalStateException if the producer has not been emitted yet.
     */
    public Symbol symbolFor(SourceRef source) {
        Symbol symbol = nodeOutputs.get(source);
        if (symbol == null)
            throw new IllegalStateException("No symbol emitted for " + source);
        return symbol;
    }

    public Map<SourceRef, Symbol> nodeOutputs() {
        return Collections.unmodifiableMap(nodeOutputs);
    }

    void appendStatement(String statement) {
        statements.add(statement);
    }

    /** Statements emitted so far by the builder, without indentation. */
    public List<String> statements() {
        return Collections.unmodifiableList(statements);
    }

    public void markReturnEmitted() {
        returnEmitted = true;
    }

    public boolean isReturnEmitted() {
        return returnEmitted;
    }
}
