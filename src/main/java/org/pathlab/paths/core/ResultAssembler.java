package org.pathlab.paths.core;

import org.pathlab.core.id.NodeIndexMapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a per-index {@link SearchOutcome} back into label-keyed distance and path maps.
 */
public final class ResultAssembler {

    private ResultAssembler() {
    }

    public static <N> ShortestPathResult<N> assemble(AdjacencySnapshot<N> graph, SearchOutcome outcome, int precision) {
        NodeIndexMapper<N> nodeIndex = graph.nodeIndex();
        double[] distances = outcome.distances();
        double[] reported = outcome.reportedDistances();
        int[] predecessors = outcome.predecessors();

        Map<N, Double> distanceMap = new LinkedHashMap<>();
        Map<N, List<N>> pathMap = new LinkedHashMap<>();
        for (int node = 0; node < graph.nodeCount(); node++) {
            if (distances[node] == Double.POSITIVE_INFINITY) {
                continue;
            }
            N label = nodeIndex.toLabel(node);
            distanceMap.put(label, round(reported[node], precision));
            pathMap.put(label, reconstructPath(nodeIndex, predecessors, node));
        }
        return ShortestPathResult.<N>builder()
                .distances(Collections.unmodifiableMap(distanceMap))
                .paths(Collections.unmodifiableMap(pathMap))
                .stats(outcome.stats())
                .build();
    }

    /**
     * Rounds half-even on the exact binary value of {@code value}.
     */
    static double round(double value, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0, got " + precision);
        }
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static <N> List<N> reconstructPath(NodeIndexMapper<N> nodeIndex, int[] predecessors, int node) {
        List<N> path = new ArrayList<>();
        int current = node;
        int steps = 0;
        while (current != SearchContext.NO_PREDECESSOR) {
            if (steps++ > predecessors.length) {
                throw new IllegalStateException("predecessor cycle detected while walking back from " + nodeIndex.toLabel(node));
            }
            path.add(nodeIndex.toLabel(current));
            current = predecessors[current];
        }
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }
}
