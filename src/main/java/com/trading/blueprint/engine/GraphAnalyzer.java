package com.trading.blueprint.engine;

import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.Connection;
import com.trading.blueprint.model.NodeScope;
import com.trading.blueprint.model.Port;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Read-only structural analysis of a blueprint: ordering, cycle and
 * completeness checks, dependency queries and the history a strategy needs.
 *
 * <p>
 * The analyzer holds no state of its own; every call reads the graph as it is
 * at that moment.
 */
@Log4j2
public final class GraphAnalyzer {
    private final BlueprintGraph graph;

    public GraphAnalyzer(BlueprintGraph graph) {
        this.graph = graph;
    }

    /** Kahn's order over input connections. Never throws on a cycle. */
    public TopologicalOrder topologicalOrder() {
        TopologicalOrder.Builder topo = TopologicalOrder.builder();
        List<BlueprintNode> nodes = graph.nodes();
        for (BlueprintNode node : nodes)
            topo.addNode(node);
        for (BlueprintNode node : nodes) {
            for (Connection c : graph.incomingConnections(node.id()))
                topo.addEdge(c.source().nodeId(), node.id());
        }
        return topo.build();
    }

    public boolean hasCycle() {
        return topologicalOrder().hasCycle();
    }

    /**
     * Nodes with every producer ahead of its consumers.
     *
     * @throws CycleDetectedException if the graph has a cycle
     */
    public List<BlueprintNode> executionOrder() {
        TopologicalOrder order = topologicalOrder();
        if (order.hasCycle())
            throw new CycleDetectedException(order.nodeCount(), order.totalNodes());
        return order.nodes();
    }

    /**
     * Every node upstream of {@code nodeId}, found depth-first over input
     * connections; each appears once, the node itself never.
     */
    public List<BlueprintNode> dependencies(String nodeId) {
        BlueprintNode start = graph.requireNode(nodeId);
        List<BlueprintNode> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(start.id());
        collectUpstream(start, visited, result);
        return result;
    }

    private void collectUpstream(BlueprintNode node, Set<String> visited, List<BlueprintNode> out) {
        for (Connection c : graph.incomingConnections(node.id())) {
            BlueprintNode source = graph.requireNode(c.source().nodeId());
            if (visited.add(source.id())) {
                out.add(source);
                collectUpstream(source, visited, out);
            }
        }
    }

    /** Every node downstream of {@code nodeId}, breadth-first. */
    public List<BlueprintNode> dependents(String nodeId) {
        graph.requireNode(nodeId);
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            for (Connection c : graph.outgoingConnections(queue.poll())) {
                String target = c.target().nodeId();
                if (!target.equals(nodeId) && seen.add(target))
                    queue.add(target);
            }
        }
        return seen.stream().map(graph::requireNode).toList();
    }

    public List<BlueprintNode> tradeNodes() {
        return nodesIn(NodeCategory.TRADE);
    }

    public List<BlueprintNode> dataNodes() {
        return nodesIn(NodeCategory.DATA);
    }

    private List<BlueprintNode> nodesIn(NodeCategory category) {
        return graph.nodes().stream().filter(n -> n.spec().category() == category).toList();
    }

    /**
     * Checks the graph is compilable. Issues accumulate; a cycle does not stop
     * the remaining checks.
     */
    public ValidationResult validate() {
        List<String> issues = new ArrayList<>();

        TopologicalOrder order = topologicalOrder();
        if (order.hasCycle()) {
            List<String> stuck = new ArrayList<>();
            for (BlueprintNode n : graph.nodes()) {
                if (!order.contains(n.id()))
                    stuck.add(n.title() + " [" + n.id() + "]");
            }
            issues.add("Graph contains a cycle: " + String.join(", ", stuck) + " cannot be ordered");
        }

        for (BlueprintNode node : graph.nodes()) {
            NodeScope scope = new NodeScope(graph, node);
            for (Port in : node.inputs()) {
                if (in.definition().required() && !scope.isSatisfied(in.name()))
                    issues.add(String.format("Node '%s' [%s]: required input '%s' is not connected",
                            node.title(), node.id(), in.name()));
            }
        }

        if (tradeNodes().isEmpty())
            issues.add("No trade node: the strategy will never place an order");

        ValidationResult result = ValidationResult.of(issues);
        log.debug("Validated {} nodes, {} connections: {} issue(s)",
                graph.nodeCount(), graph.connectionCount(), issues.size());
        return result;
    }

    /**
     * Bars of history the strategy needs before its first decision: the
     * largest of {@code period + 1}, {@code count} and {@code slow + 10} over
     * all nodes, at least 1.
     */
    public int requiredLookback() {
        int max = 1;
        for (BlueprintNode node : graph.nodes()) {
            max = Math.max(max, intParam(node, "period", 1));
            max = Math.max(max, intParam(node, "count", 0));
            max = Math.max(max, intParam(node, "slow", 10));
        }
        return max;
    }

    /** Parameter {@code key} plus {@code offset}, or 0 when unset, zero or unreadable. */
    private static int intParam(BlueprintNode node, String key, int offset) {
        Object v = node.parameter(key);
        if (v == null || v instanceof Boolean)
            return 0;
        long value;
        try {
            value = v instanceof Number n ? n.longValue() : (long) Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric '{}' = '{}' on {} for lookback", key, v, node);
            return 0;
        }
        if (value == 0)
            return 0;
        if (value > Integer.MAX_VALUE - offset) {
            log.warn("Lookback '{}' = {} on {} is out of range, capping at {}", key, v, node, Integer.MAX_VALUE);
            return Integer.MAX_VALUE;
        }
        return (int) Math.max(value + offset, Integer.MIN_VALUE);
    }
}
