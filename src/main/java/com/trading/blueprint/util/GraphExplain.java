package com.trading.blueprint.util;

import com.trading.blueprint.engine.GraphAnalyzer;
import com.trading.blueprint.engine.TopologicalOrder;
import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.Connection;
import com.trading.blueprint.model.NodeScope;
import com.trading.blueprint.model.Port;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a blueprint.
 *
 * <p>
 * Produces human-readable text for logs and debugging sessions, and a Mermaid
 * diagram for embedding in Markdown.
 */
public final class GraphExplain {
    private final BlueprintGraph graph;
    private final GraphAnalyzer analyzer;

    public GraphExplain(BlueprintGraph graph) {
        this.graph = graph;
        this.analyzer = new GraphAnalyzer(graph);
    }

    /**
     * Dumps one node: type, parameters, what each input resolves to and what
     * each output stands for in generated code.
     */
    public String explainNode(String nodeId) {
        BlueprintNode node = graph.requireNode(nodeId);
        NodeScope scope = new NodeScope(graph, node);
        boolean acyclic = !analyzer.hasCycle();
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.title()).append(" [").append(node.id()).append("]\n")
                .append("  Type: ").append(node.type()).append('\n')
                .append("  Category: ").append(node.spec().category().tag()).append('\n');
        for (Map.Entry<String, Object> e : node.parameters().entrySet())
            sb.append("  Param ").append(e.getKey()).append(" = ").append(PythonLiterals.repr(e.getValue()))
                    .append('\n');
        for (Port in : node.inputs()) {
            sb.append("  In  ").append(in.name()).append(" (").append(in.dataType()).append("): ");
            // expressions of a cyclic graph never bottom out
            sb.append(acyclic ? String.valueOf(scope.inputValue(in.name())) : "?").append('\n');
        }
        for (Port out : node.outputs()) {
            sb.append("  Out ").append(out.name()).append(" (").append(out.dataType()).append("): ");
            sb.append(acyclic ? scope.outputExpression(out.name()) : "?");
            sb.append(" -> ").append(out.connectionIds().size()).append(" consumer(s)\n");
        }
        return sb.toString();
    }

    /**
     * Dumps the ordered nodes with their downstream consumers. Nodes caught in
     * a cycle are listed last.
     */
    public String dumpTopology() {
        TopologicalOrder order = analyzer.topologicalOrder();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Blueprint (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.connectionCount()).append(" connections):\n");
        for (int i = 0; i < order.nodeCount(); i++)
            appendNodeLine(sb, String.valueOf(i), order.node(i));
        if (order.hasCycle()) {
            for (BlueprintNode n : graph.nodes()) {
                if (!order.contains(n.id()))
                    appendNodeLine(sb, "cycle", n);
            }
        }
        return sb.toString();
    }

    private void appendNodeLine(StringBuilder sb, String slot, BlueprintNode node) {
        sb.append("  [").append(slot).append("] ").append(node.id()).append(' ').append(node.type());
        List<Connection> out = graph.outgoingConnections(node.id());
        if (!out.isEmpty()) {
            sb.append(" -> ");
            for (int j = 0; j < out.size(); j++) {
                Connection c = out.get(j);
                sb.append(c.target().nodeId()).append('.').append(c.target().port());
                if (j < out.size() - 1)
                    sb.append(", ");
            }
        }
        sb.append('\n');
    }

    /**
     * Generates a Mermaid graph diagram. Edges are labelled with the ports they
     * join.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph LR;\n");
        for (BlueprintNode node : graph.nodes()) {
            sb.append("  ").append(sanitize(node.id())).append("[\"<b>").append(node.title())
                    .append("</b><br/>").append(node.type()).append("\"];\n");
        }
        for (Connection c : graph.connections()) {
            sb.append("  ").append(sanitize(c.source().nodeId()))
                    .append(" -- \"").append(c.source().port()).append(" → ").append(c.target().port())
                    .append("\" --> ").append(sanitize(c.target().nodeId())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return "n_" + name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
