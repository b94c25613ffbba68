package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.CycleDetectedException;
import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.node.ClassDefinitionNode;
import com.vsharp.vgc.node.DefinitionNode;
import com.vsharp.vgc.node.RuntimeNode;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assembles a complete Java compilation unit from a node graph.
 *
 * Output layout:
 * <ol>
 * <li>one {@code import} per entry of the context's import set;</li>
 * <li>one class declaration per {@link ClassDefinitionNode} in the registry;</li>
 * <li>a public entry class with a static, parameterless method returning
 * {@code Object}, holding one statement per runtime node in schedule
 * order. The return node, if any, is emitted last.</li>
 * </ol>
 *
 * The build either returns the whole unit or throws. A cycle is reported before
 * any node is asked to emit, and an exception from a node aborts the build
 * without returning partial text.
 */
public final class CodeBuilder {
    private static final Logger log = LogManager.getLogger(CodeBuilder.class);

    private final BuildOptions options;

    public CodeBuilder() {
        this(BuildOptions.defaults());
    }

    public CodeBuilder(BuildOptions options) {
        this.options = options;
    }

    public BuildOptions options() {
        return options;
    }

    /**
     * Builds the source text.
     *
     * @param nodes   All nodes of the graph.
     * @param context A fresh context for this build.
     * @return The complete compilation unit.
     * @throws CycleDetectedException        if the graph has a cycle.
     * @throws UnsupportedOperationException if a definition node is in the
     *                                       list and the policy is REJECT.
     * @throws IllegalStateException         if the graph has more than one
     *                                       return node.
     */
    public String build(List<? extends GraphNode> nodes, CodeGenContext context) {
        log.debug("Building {} with {} nodes", options.getClassName(), nodes.size());
        List<GraphNode> schedule = TopologicalOrder.sort(nodes);

        for (String imp : options.getDefaultImports())
            context.addImport(imp);

        String indent = options.getIndent();
        StringBuilder sb = new StringBuilder(1024);
        for (String u : context.imports())
            sb.append("import ").append(u).append(";\n");
        if (!context.imports().isEmpty())
            sb.append('\n');

        for (DefinitionNode def : context.registry().all()) {
            if (def instanceof ClassDefinitionNode cls)
                sb.append(cls.generateDefinitionCode(indent)).append("\n\n");
        }

        sb.append("public class ").append(options.getClassName()).append(" {\n")
                .append(indent).append("public static Object ").append(options.getMethodName()).append("() {\n");

        String bodyIndent = indent + indent;
        RuntimeNode terminal = null;
        for (GraphNode node : schedule) {
            if (node instanceof RuntimeNode runtime) {
                if (runtime.isTerminal()) {
                    if (terminal != null)
                        throw new IllegalStateException("Multiple terminal nodes: " + terminal.label()
                                + " and " + runtime.label());
                    terminal = runtime;
                }
            } else if (options.getDefinitionNodePolicy() == BuildOptions.DefinitionNodePolicy.REJECT) {
                throw new UnsupportedOperationException(node.label() + " cannot emit statements");
            }
        }

        for (GraphNode node : schedule) {
            if (node instanceof RuntimeNode runtime) {
                if (!runtime.isTerminal())
                    emit(runtime, context, sb, bodyIndent);
            } else {
                log.debug("Skipped {} in statement path", node.label());
            }
        }
        // nothing can follow a return in Java source
        if (terminal != null)
            emit(terminal, context, sb, bodyIndent);
        if (!context.isReturnEmitted()) {
            context.appendStatement("return null;");
            sb.append(bodyIndent).append("return null;\n");
        }

        sb.append(indent).append("}\n").append("}\n");
        return sb.toString();
    }

    private static void emit(RuntimeNode node, CodeGenContext context, StringBuilder sb, String bodyIndent) {
        for (String line : node.generateCode(context)) {
            context.appendStatement(line);
            sb.append(bodyIndent).append(line).append('\n');
        }
        log.debug("Emitted {}", node.label());
    }
}
