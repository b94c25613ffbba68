package com.vsharp.vgc;

import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.dsl.GraphBuilder;
import com.vsharp.vgc.engine.BuildOptions;
import com.vsharp.vgc.engine.CodeBuilder;
import com.vsharp.vgc.engine.CodeGenContext;
import com.vsharp.vgc.io.DefinitionRegistry;
import com.vsharp.vgc.toolchain.Toolchain;

import java.util.List;

/**
 * VGraph -- visual-programming compiler core.
 *
 * <p>
 * A program is a directed graph of typed nodes:
 * <ul>
 * <li><b>Runtime nodes</b> emit statements (literals, arithmetic, return).</li>
 * <li><b>Definition nodes</b> declare types and method signatures, usually
 * imported from external metadata into a {@link DefinitionRegistry}.</li>
 * <li><b>Bindings</b> connect an output slot to an input slot of equal
 * type.</li>
 * </ul>
 * Building orders the runtime nodes by dependency and lowers them to one Java
 * compilation unit, which a {@link Toolchain} compiles and executes.
 */
public final class VGraph {

    private VGraph() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new graph builder.
     *
     * @param graphName A descriptive name for the graph.
     */
    public static GraphBuilder builder(String graphName) {
        return GraphBuilder.create(graphName);
    }

    /** Emits source for a node list with a fresh context over the given registry. */
    public static String compile(List<? extends GraphNode> nodes, DefinitionRegistry registry, BuildOptions options) {
        return new CodeBuilder(options).build(nodes, new CodeGenContext(registry));
    }

    /**
     * Emits source and runs it.
     *
     * @return The value returned by the entry point.
     * @throws com.vsharp.vgc.api.ToolchainFailureException on error diagnostics.
     */
    public static Object compileAndRun(List<? extends GraphNode> nodes, DefinitionRegistry registry,
            BuildOptions options, Toolchain toolchain) {
        String source = compile(nodes, registry, options);
        return toolchain.compileAndExecute(source).requireSuccess(source);
    }
}
