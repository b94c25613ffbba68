package com.vsharp.vgc.dsl;

import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.engine.BuildOptions;
import com.vsharp.vgc.engine.CodeBuilder;
import com.vsharp.vgc.engine.CodeGenContext;
import com.vsharp.vgc.engine.GenericTypeResolver;
import com.vsharp.vgc.engine.NodeConnector;
import com.vsharp.vgc.io.DefinitionRegistry;
import com.vsharp.vgc.io.ReflectionImporter;
import com.vsharp.vgc.io.TypeMetadata;
import com.vsharp.vgc.node.BinaryOpNode;
import com.vsharp.vgc.node.BinaryOperator;
import com.vsharp.vgc.node.ClassDefinitionNode;
import com.vsharp.vgc.node.LiteralNode;
import com.vsharp.vgc.node.ReturnNode;
import com.vsharp.vgc.toolchain.JavaSourceToolchain;
import com.vsharp.vgc.toolchain.Toolchain;
import com.vsharp.vgc.toolchain.ToolchainResult;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Graph Builder -- the host-facing API.
 *
 * Holds the nodes of one graph in an arena keyed by node id, together with the
 * definition registry of the session. Nodes refer to each other only through
 * the bindings recorded by {@link #connect}.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("sum");
 * 2. Add values: var a = g.literal(ValueType.INT, 7);
 * 3. Combine: var sum = g.add(a, b);
 * 4. Finish: g.returns(sum);
 * 5. Emit or run: String src = g.build(); Object v = g.run();
 */
@Log4j2
public final class GraphBuilder {
    private final String graphName;
    private final BuildOptions options;
    private final Map<String, GraphNode> nodesById = new LinkedHashMap<>();
    private final DefinitionRegistry registry = new DefinitionRegistry();

    private GraphBuilder(String graphName, BuildOptions options) {
        this.graphName = graphName;
        this.options = options;
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName, BuildOptions.defaults());
    }

    public static GraphBuilder create(String graphName, BuildOptions options) {
        return new GraphBuilder(graphName, options);
    }

    public String name() {
        return graphName;
    }

    // ── Nodes ────────────────────────────────────────────────────

    /** Adds an externally constructed node to the graph. */
    public <T extends GraphNode> T addNode(T node) {
        if (nodesById.putIfAbsent(node.id(), node) != null)
            throw new IllegalArgumentException("Duplicate node: " + node.label());
        return node;
    }

    public LiteralNode literal(ValueType type, Object value) {
        return addNode(new LiteralNode(type, value));
    }

    /**
     * @param nameHint Prefix of the emitted symbol.
     */
    public LiteralNode literal(String nameHint, ValueType type, Object value) {
        return addNode(new LiteralNode(type, nameHint, value));
    }

    /** Integer addition of two single-output nodes. */
    public BinaryOpNode add(GraphNode left, GraphNode right) {
        return binary(BinaryOpNode.add(), left, right);
    }

    /** Applies an operator to two single-output nodes of the given type. */
    public BinaryOpNode binary(BinaryOperator operator, ValueType type, GraphNode left, GraphNode right) {
        return binary(new BinaryOpNode(operator, type), left, right);
    }

    /** Applies an operator whose type is taken from the connected operands. */
    public BinaryOpNode generic(BinaryOperator operator, GraphNode left, GraphNode right) {
        return binary(BinaryOpNode.generic(operator), left, right);
    }

    private BinaryOpNode binary(BinaryOpNode node, GraphNode left, GraphNode right) {
        addNode(node);
        connect(left, singleOutput(left).name(), node, BinaryOpNode.LEFT);
        connect(right, singleOutput(right).name(), node, BinaryOpNode.RIGHT);
        return node;
    }

    /** Returns the value of a single-output node from the entry point. */
    public ReturnNode returns(GraphNode value) {
        Slot out = singleOutput(value);
        ReturnNode ret = addNode(out.isUnresolved() ? ReturnNode.generic() : new ReturnNode(out.type()));
        connect(value, out.name(), ret, ReturnNode.INPUT);
        return ret;
    }

    // ── Wiring ───────────────────────────────────────────────────

    /**
     * Connects an output to an input, resolving generic groups first. Both
     * nodes must belong to this graph.
     */
    public GraphBuilder connect(GraphNode from, String outputName, GraphNode to, String inputName) {
        requireOwned(from);
        requireOwned(to);
        GenericTypeResolver.unify(from, outputName, to, inputName);
        NodeConnector.connect(from, outputName, to, inputName);
        return this;
    }

    // ── Definitions ──────────────────────────────────────────────

    public Optional<ClassDefinitionNode> importType(Class<?> type) {
        return ReflectionImporter.importType(type, registry);
    }

    public Optional<ClassDefinitionNode> importType(TypeMetadata meta) {
        return ReflectionImporter.importType(meta, registry);
    }

    public DefinitionRegistry registry() {
        return registry;
    }

    // ── Access & Build ───────────────────────────────────────────

    public List<GraphNode> nodes() {
        return List.copyOf(nodesById.values());
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /** Emits the graph as source text, using a fresh context. */
    public String build() {
        return new CodeBuilder(options).build(nodes(), new CodeGenContext(registry));
    }

    /**
     * Compiles and runs the graph in memory with a {@link JavaSourceToolchain}
     * configured from this builder's options, so the entry class and method
     * always match the emitted source.
     *
     * @return The value returned by the entry point.
     * @throws com.vsharp.vgc.api.ToolchainFailureException on error diagnostics.
     */
    public Object run() {
        return run(new JavaSourceToolchain(options));
    }

    /**
     * Emits the graph and hands it to the toolchain. The toolchain must expect
     * the entry class and method named by this builder's options.
     *
     * @return The value returned by the entry point.
     * @throws com.vsharp.vgc.api.ToolchainFailureException on error diagnostics.
     */
    public Object run(Toolchain toolchain) {
        String source = build();
        ToolchainResult result = toolchain.compileAndExecute(source);
        log.debug("Graph '{}' ran with {} diagnostics", graphName, result.diagnostics().size());
        return result.requireSuccess(source);
    }

    private void requireOwned(GraphNode node) {
        if (nodesById.get(node.id()) != node)
            throw new IllegalArgumentException("Unknown node: " + node.label() + " is not part of graph " + graphName);
    }

    private static Slot singleOutput(GraphNode node) {
        if (node.outputs().size() != 1)
            throw new IllegalArgumentException(node.label() + " has " + node.outputs().size()
                    + " outputs, name the output explicitly");
        return node.outputs().get(0);
    }
}
