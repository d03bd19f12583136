package org.pathlab.paths.core;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Distances and paths of every node reached by a search.
 * <p>
 * Both maps share the same key set and follow the graph's node insertion order.
 * Each path runs from a source to its key, both ends included.
 *
 * @param <N> node label type.
 */
@Value
@Builder
public class ShortestPathResult<N> {
    Map<N, Double> distances;
    Map<N, List<N>> paths;
    /** Work counters; {@code null} for algorithms that do not collect them. */
    BmsspExecutionStats stats;

    public boolean isReachable(N node) {
        return distances.containsKey(node);
    }
}
