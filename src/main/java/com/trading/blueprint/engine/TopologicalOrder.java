package com.trading.blueprint.engine;

import com.trading.blueprint.model.BlueprintNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency order of a blueprint, producers before consumers.
 *
 * <p>
 * Built with Kahn's algorithm. Nodes that start with no incoming edges are
 * seeded in the order they were added, so the result is stable for a given
 * graph. When the graph has a cycle, the nodes on or behind it never reach
 * in-degree zero: {@link #hasCycle()} is set and {@link #nodes()} holds only
 * the nodes that could be ordered.
 */
public final class TopologicalOrder {
    private final BlueprintNode[] order;
    private final Map<String, Integer> idToIndex;
    private final int totalNodes;

    private TopologicalOrder(BlueprintNode[] order, Map<String, Integer> idToIndex, int totalNodes) {
        this.order = order;
        this.idToIndex = idToIndex;
        this.totalNodes = totalNodes;
    }

    public boolean hasCycle() {
        return order.length != totalNodes;
    }

    /** Number of nodes that were ordered. */
    public int nodeCount() {
        return order.length;
    }

    /** Number of nodes handed to the builder. */
    public int totalNodes() {
        return totalNodes;
    }

    public BlueprintNode node(int ti) {
        return order[ti];
    }

    /**
     * Position of a node in the order.
     *
     * @throws IllegalArgumentException if the node was not ordered
     */
    public int topoIndex(String nodeId) {
        Integer idx = idToIndex.get(nodeId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown or unordered node: " + nodeId);
        return idx;
    }

    public boolean contains(String nodeId) {
        return idToIndex.containsKey(nodeId);
    }

    public List<BlueprintNode> nodes() {
        return List.of(order);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects nodes and dependency edges, then sorts them.
     */
    public static final class Builder {
        private final List<BlueprintNode> nodes = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(BlueprintNode node) {
            if (idToIdx.containsKey(node.id()))
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            idToIdx.put(node.id(), nodes.size());
            nodes.add(node);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** Records that {@code to} depends on {@code from}. Parallel edges are allowed. */
        public Builder addEdge(String from, String to) {
            int f = requireIndex(from), t = requireIndex(to);
            if (f == t)
                throw new IllegalArgumentException("Self-edge on node: " + from);
            forwardEdges.get(f).add(t);
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        /**
         * Performs Kahn's algorithm. Never throws on a cycle; check
         * {@link TopologicalOrder#hasCycle()}.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (List<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            // 2. Seed queue with in-degree 0, in insertion order
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue
            while (head < tail) {
                int curr = queue[head++];
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }

            // queue[0..tail) is the order; anything missing sits on or behind a cycle
            int[] resolved = Arrays.copyOf(queue, tail);
            BlueprintNode[] ordered = new BlueprintNode[tail];
            Map<String, Integer> index = new HashMap<>(tail * 2);
            for (int ti = 0; ti < tail; ti++) {
                ordered[ti] = nodes.get(resolved[ti]);
                index.put(ordered[ti].id(), ti);
            }
            return new TopologicalOrder(ordered, index, n);
        }
    }
}
