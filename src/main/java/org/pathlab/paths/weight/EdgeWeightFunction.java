package org.pathlab.paths.weight;

import java.util.Map;

/**
 * Caller-supplied weight of one edge.
 *
 * @param <N> node label type.
 */
@FunctionalInterface
public interface EdgeWeightFunction<N> {

    /**
     * Returns the weight of the edge {@code source -> target}.
     *
     * @param source     edge origin.
     * @param target     edge destination.
     * @param attributes attributes of this edge.
     * @return the non-negative weight, or {@code null} to hide the edge.
     */
    Number weight(N source, N target, Map<String, Object> attributes);
}
