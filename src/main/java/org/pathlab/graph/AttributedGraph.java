package org.pathlab.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable graph with attribute maps on nodes and edges.
 *
 * <p>Three flavours are supported: {@link #directed()}, {@link #multiDirected()} and
 * {@link #undirected()}. Adding an existing edge to a simple graph merges the new
 * attributes into the existing ones; on a multigraph it adds a parallel edge with the
 * next free key.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <N> node label type.
 */
public final class AttributedGraph<N> implements Graph<N> {
    public static final String DEFAULT_WEIGHT = "weight";

    private final boolean directed;
    private final boolean multigraph;

    private final LinkedHashMap<N, Map<String, Object>> nodeAttributes = new LinkedHashMap<>();
    // adjacency[u][v] -> parallel edge attribute maps, index = key
    private final LinkedHashMap<N, LinkedHashMap<N, List<Map<String, Object>>>> adjacency = new LinkedHashMap<>();
    private int edgeCount;

    private AttributedGraph(boolean directed, boolean multigraph) {
        this.directed = directed;
        this.multigraph = multigraph;
    }

    public static <N> AttributedGraph<N> directed() {
        return new AttributedGraph<>(true, false);
    }

    public static <N> AttributedGraph<N> multiDirected() {
        return new AttributedGraph<>(true, true);
    }

    public static <N> AttributedGraph<N> undirected() {
        return new AttributedGraph<>(false, false);
    }

    @Override
    public boolean isDirected() {
        return directed;
    }

    @Override
    public boolean isMultigraph() {
        return multigraph;
    }

    /**
     * Adds a node without attributes. Existing nodes are left untouched.
     */
    public AttributedGraph<N> addNode(N node) {
        return addNode(node, Map.of());
    }

    /**
     * Adds a node or merges attributes into an existing one.
     */
    public AttributedGraph<N> addNode(N node, Map<String, ?> attributes) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(attributes, "attributes");
        nodeAttributes.computeIfAbsent(node, ignored -> new HashMap<>()).putAll(attributes);
        adjacency.computeIfAbsent(node, ignored -> new LinkedHashMap<>());
        return this;
    }

    /**
     * Adds an edge without attributes; missing endpoints are created.
     */
    public AttributedGraph<N> addEdge(N source, N target) {
        return addEdge(source, target, Map.of());
    }

    /**
     * Adds an edge carrying {@value #DEFAULT_WEIGHT}.
     */
    public AttributedGraph<N> addWeightedEdge(N source, N target, double weight) {
        return addEdge(source, target, Map.of(DEFAULT_WEIGHT, weight));
    }

    /**
     * Adds an edge; missing endpoints are created.
     *
     * @return this graph for chaining.
     */
    public AttributedGraph<N> addEdge(N source, N target, Map<String, ?> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        addNode(source);
        addNode(target);

        List<Map<String, Object>> parallel = adjacency.get(source).get(target);
        if (parallel != null && !multigraph) {
            parallel.get(0).putAll(attributes);
            return this;
        }

        Map<String, Object> data = new HashMap<>(attributes);
        if (parallel == null) {
            parallel = new ArrayList<>(1);
            adjacency.get(source).put(target, parallel);
            if (!directed && !source.equals(target)) {
                adjacency.get(target).put(source, parallel);
            }
        }
        parallel.add(data);
        edgeCount++;
        return this;
    }

    /**
     * Returns whether at least one edge joins source to target.
     */
    public boolean containsEdge(N source, N target) {
        Map<N, List<Map<String, Object>>> out = adjacency.get(source);
        return out != null && out.containsKey(target);
    }

    /**
     * Returns the attribute maps of all parallel edges from source to target, key order.
     */
    public List<Map<String, Object>> edgeAttributes(N source, N target) {
        Map<N, List<Map<String, Object>>> out = adjacency.get(source);
        List<Map<String, Object>> parallel = out == null ? null : out.get(target);
        if (parallel == null) {
            throw new IllegalArgumentException("No edge " + source + " -> " + target);
        }
        List<Map<String, Object>> views = new ArrayList<>(parallel.size());
        for (Map<String, Object> data : parallel) {
            views.add(Collections.unmodifiableMap(data));
        }
        return views;
    }

    @Override
    public Collection<N> nodes() {
        return Collections.unmodifiableSet(nodeAttributes.keySet());
    }

    @Override
    public boolean containsNode(N node) {
        return node != null && nodeAttributes.containsKey(node);
    }

    @Override
    public int nodeCount() {
        return nodeAttributes.size();
    }

    @Override
    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public Map<String, Object> nodeAttributes(N node) {
        Map<String, Object> data = nodeAttributes.get(node);
        if (data == null) {
            throw new IllegalArgumentException("Node not in graph: " + node);
        }
        return Collections.unmodifiableMap(data);
    }

    @Override
    public Iterable<Edge<N>> edges() {
        List<Edge<N>> edges = new ArrayList<>(edgeCount);
        Set<N> reported = directed ? null : new HashSet<>();
        for (Map.Entry<N, LinkedHashMap<N, List<Map<String, Object>>>> out : adjacency.entrySet()) {
            N source = out.getKey();
            if (reported != null) {
                reported.add(source);
            }
            for (Map.Entry<N, List<Map<String, Object>>> entry : out.getValue().entrySet()) {
                N target = entry.getKey();
                if (reported != null && reported.contains(target) && !target.equals(source)) {
                    // already reported from the other endpoint
                    continue;
                }
                List<Map<String, Object>> parallel = entry.getValue();
                for (int key = 0; key < parallel.size(); key++) {
                    edges.add(new Edge<>(source, target, key, Collections.unmodifiableMap(parallel.get(key))));
                }
            }
        }
        return Collections.unmodifiableList(edges);
    }

    /**
     * Returns a directed copy. Undirected edges become two opposite arcs sharing
     * copies of the same attributes; directed graphs are copied as-is.
     */
    public AttributedGraph<N> toDirected() {
        AttributedGraph<N> copy = new AttributedGraph<>(true, multigraph);
        for (Map.Entry<N, Map<String, Object>> node : nodeAttributes.entrySet()) {
            copy.addNode(node.getKey(), node.getValue());
        }
        for (Map.Entry<N, LinkedHashMap<N, List<Map<String, Object>>>> out : adjacency.entrySet()) {
            for (Map.Entry<N, List<Map<String, Object>>> entry : out.getValue().entrySet()) {
                for (Map<String, Object> data : entry.getValue()) {
                    copy.addEdge(out.getKey(), entry.getKey(), data);
                }
            }
        }
        return copy;
    }
}
