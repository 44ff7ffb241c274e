package com.xelogen.tools;

import com.xelogen.graph.Graph;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Text listing of a graph for debugging, one block per node in insertion order:
 * <pre>
 * 2 NumChildren
 *     slot from [1&lt;RootSlot&gt;:*]
 * 4 StringInput
 *     'World/Meow'
 * </pre>
 * A node with content shows the content instead of its inputs.
 */
public final class GraphPrinter {

    private static final Logger log = LoggerFactory.getLogger(GraphPrinter.class);

    private static final String INDENT = "    ";

    private GraphPrinter() {
    }

    public static String render(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        StringBuilder sb = new StringBuilder();
        for (Node node : graph.nodes()) {
            appendNode(sb, node);
        }
        return sb.toString();
    }

    /** Logs {@link #render(Graph)} at INFO. */
    public static void print(Graph graph) {
        if (log.isInfoEnabled()) {
            log.info("Graph listing | nodes={}\n{}", graph.size(), render(graph));
        }
    }

    public static String renderNode(Node node) {
        StringBuilder sb = new StringBuilder();
        appendNode(sb, node);
        return sb.toString();
    }

    private static void appendNode(StringBuilder sb, Node node) {
        sb.append(node.getId()).append(' ').append(node.getTypeName()).append('\n');
        Object content = node.hasContentSlot() ? node.getContent() : null;
        if (content != null) {
            sb.append(INDENT).append(literal(content)).append('\n');
            return;
        }
        for (Map.Entry<String, List<OutputPort>> input : node.getInputs().entrySet()) {
            sb.append(INDENT).append(input.getKey()).append(" from [")
                    .append(input.getValue().stream().map(OutputPort::toString).collect(Collectors.joining(", ")))
                    .append("]\n");
        }
    }

    private static String literal(Object content) {
        return content instanceof String s ? "'" + s + "'" : String.valueOf(content);
    }
}
