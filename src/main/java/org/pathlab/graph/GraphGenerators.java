package org.pathlab.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Small deterministic graph builders.
 */
public final class GraphGenerators {

    private GraphGenerators() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the undirected path {@code 0 - 1 - ... - (n-1)}.
     */
    public static AttributedGraph<Integer> pathGraph(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        AttributedGraph<Integer> graph = AttributedGraph.undirected();
        for (int i = 0; i < n; i++) {
            graph.addNode(i);
        }
        for (int i = 0; i + 1 < n; i++) {
            graph.addEdge(i, i + 1);
        }
        return graph;
    }

    /**
     * Adds consecutive edges along {@code nodes}.
     */
    @SafeVarargs
    public static <N> AttributedGraph<N> addPath(AttributedGraph<N> graph, N... nodes) {
        for (int i = 0; i + 1 < nodes.length; i++) {
            graph.addEdge(nodes[i], nodes[i + 1]);
        }
        return graph;
    }

    /**
     * Adds consecutive edges along {@code nodes} and closes the cycle back to the first node.
     */
    @SafeVarargs
    public static <N> AttributedGraph<N> addCycle(AttributedGraph<N> graph, N... nodes) {
        addPath(graph, nodes);
        if (nodes.length > 0) {
            graph.addEdge(nodes[nodes.length - 1], nodes[0]);
        }
        return graph;
    }

    /**
     * Returns a uniformly random graph with {@code n} nodes and {@code m} distinct edges,
     * no self loops. Same seed, same graph.
     *
     * @throws IllegalArgumentException if {@code m} exceeds the number of possible edges.
     */
    public static AttributedGraph<Integer> gnmRandomGraph(int n, int m, long seed, boolean directed) {
        if (n < 0 || m < 0) {
            throw new IllegalArgumentException("n and m must be >= 0");
        }
        long maxEdges = (long) n * (n - 1) / (directed ? 1 : 2);
        if (m > maxEdges) {
            throw new IllegalArgumentException("m=" + m + " exceeds max edge count " + maxEdges);
        }
        AttributedGraph<Integer> graph = directed ? AttributedGraph.directed() : AttributedGraph.undirected();
        List<Integer> nodes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            graph.addNode(i);
            nodes.add(i);
        }
        Random random = new Random(seed);
        int added = 0;
        while (added < m) {
            int u = nodes.get(random.nextInt(n));
            int v = nodes.get(random.nextInt(n));
            if (u == v || graph.containsEdge(u, v)) {
                continue;
            }
            graph.addEdge(u, v);
            added++;
        }
        return graph;
    }
}
