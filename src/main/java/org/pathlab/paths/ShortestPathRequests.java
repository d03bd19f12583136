package org.pathlab.paths;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pathlab.core.id.NodeIndexMapper;
import org.pathlab.graph.Graph;
import org.pathlab.paths.core.NodeNotFoundException;
import org.pathlab.paths.core.UnsupportedGraphException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Request validation shared by the shortest-path facades.
 * All checks run before any search state is allocated.
 */
final class ShortestPathRequests {

    private ShortestPathRequests() {
    }

    static void requireDirected(Graph<?> graph) {
        Objects.requireNonNull(graph, "graph");
        if (!graph.isDirected()) {
            throw new UnsupportedGraphException(
                    "shortest paths are only defined here for directed graphs; use toDirected()"
            );
        }
    }

    /**
     * Validates and de-duplicates sources, keeping first-seen order.
     */
    static <N> Set<N> requireSources(Graph<N> graph, Collection<N> sources) {
        Objects.requireNonNull(sources, "sources");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("sources must be non-empty");
        }
        Set<N> distinct = new LinkedHashSet<>();
        for (N source : sources) {
            requireNode(graph, source);
            distinct.add(source);
        }
        return distinct;
    }

    static <N> void requireNode(Graph<N> graph, N node) {
        if (node == null || !graph.containsNode(node)) {
            throw new NodeNotFoundException(node);
        }
    }

    static int requirePrecision(Integer precision) {
        if (precision == null) {
            return 0;
        }
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0, got " + precision);
        }
        return precision;
    }

    static <N> IntArrayList toIndices(NodeIndexMapper<N> nodeIndex, Set<N> nodes) {
        IntArrayList indices = new IntArrayList(nodes.size());
        for (N node : nodes) {
            try {
                indices.add(nodeIndex.toIndex(node));
            } catch (NodeIndexMapper.UnknownNodeException ex) {
                throw new NodeNotFoundException(node, ex);
            }
        }
        return indices;
    }
}
