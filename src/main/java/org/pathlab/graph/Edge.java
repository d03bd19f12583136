package org.pathlab.graph;

import java.util.Map;

/**
 * Immutable view of one edge.
 *
 * @param source     origin node.
 * @param target     destination node.
 * @param key        parallel-edge key; always 0 on simple graphs.
 * @param attributes unmodifiable attribute view.
 * @param <N> node label type.
 */
public record Edge<N>(N source, N target, int key, Map<String, Object> attributes) {
}
