package org.pathlab.graph;

import java.util.Collection;
import java.util.Map;

/**
 * Read contract consumed by the shortest-path algorithms.
 *
 * <p>Iteration orders are stable: nodes in insertion order, edges grouped by source
 * node in node order, then by target in first-insertion order, then by parallel-edge key.</p>
 *
 * @param <N> node label type.
 */
public interface Graph<N> {

    /**
     * Returns whether edges are ordered pairs.
     */
    boolean isDirected();

    /**
     * Returns whether parallel edges between the same ordered pair are allowed.
     */
    boolean isMultigraph();

    /**
     * Returns an unmodifiable view of all nodes in insertion order.
     */
    Collection<N> nodes();

    /**
     * Returns whether the node exists.
     */
    boolean containsNode(N node);

    int nodeCount();

    int edgeCount();

    /**
     * Returns all edges with their attribute maps.
     * <p>Undirected graphs report each edge once, from the endpoint that comes first in node order.</p>
     */
    Iterable<Edge<N>> edges();

    /**
     * Returns an unmodifiable view of the node's attributes.
     *
     * @throws IllegalArgumentException if the node is absent.
     */
    Map<String, Object> nodeAttributes(N node);
}
