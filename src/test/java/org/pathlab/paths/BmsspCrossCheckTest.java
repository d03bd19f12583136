package org.pathlab.paths;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pathlab.graph.AttributedGraph;
import org.pathlab.paths.core.NoPathException;
import org.pathlab.paths.core.ShortestPathResult;
import org.pathlab.paths.testutil.GraphFixtures;
import org.pathlab.paths.weight.WeightSpec;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Randomized agreement between {@link BmsspPaths} and {@link DijkstraPaths}.
 */
@DisplayName("BMSSP vs Dijkstra Cross-Check")
class BmsspCrossCheckTest {

    @ParameterizedTest(name = "n={0}, m={1}, seed={2}, maxWeight={3}")
    @CsvSource({
            "50, 150, 42, 10",
            "100, 400, 123, 20",
            "200, 600, 7, 5",
            "300, 1500, 99, 1",
            "600, 2400, 2024, 50",
            "1100, 5000, 5, 9"
    })
    @DisplayName("Integer weights: distances match Dijkstra exactly")
    void testIntegerWeights(int n, int m, long seed, int maxWeight) {
        AttributedGraph<Integer> graph = GraphFixtures.randomIntegerWeighted(n, m, seed, maxWeight);

        ShortestPathResult<Integer> bmssp = BmsspPaths.bmssp(graph, Set.of(0));
        ShortestPathResult<Integer> dijkstra = DijkstraPaths.dijkstra(graph, Set.of(0));

        assertEquals(dijkstra.getDistances(), bmssp.getDistances());
        assertPathsConsistent(graph, bmssp);
    }

    @ParameterizedTest(name = "n={0}, m={1}, seed={2}")
    @CsvSource({
            "60, 240, 3",
            "250, 900, 17",
            "700, 2000, 31"
    })
    @DisplayName("Decimal weights with zeros: distances match within precision")
    void testDecimalWeights(int n, int m, long seed) {
        AttributedGraph<Integer> graph = GraphFixtures.randomDecimalWeighted(n, m, seed, 4);
        int precision = 2;

        Map<Integer, Double> bmssp = BmsspPaths.multiSourcePathLengths(graph, Set.of(0), WeightSpec.defaultWeight(), precision);
        ShortestPathResult<Integer> dijkstra = DijkstraPaths.dijkstra(graph, Set.of(0), WeightSpec.defaultWeight(), 9);

        assertEquals(dijkstra.getDistances().keySet(), bmssp.keySet());
        for (Map.Entry<Integer, Double> entry : bmssp.entrySet()) {
            assertEquals((double) dijkstra.getDistances().get(entry.getKey()), (double) entry.getValue(), 0.5e-2 + 1e-9,
                    "distance of node " + entry.getKey());
        }
    }

    @ParameterizedTest(name = "seed={0}")
    @CsvSource({"1", "8", "64"})
    @DisplayName("Multi-source distances are the minimum over single-source runs")
    void testMultiSourceMinimum(long seed) {
        AttributedGraph<Integer> graph = GraphFixtures.randomIntegerWeighted(150, 450, seed, 12);
        List<Integer> sources = List.of(0, 17, 42, 99);

        Map<Integer, Double> combined = BmsspPaths.multiSourcePathLengths(graph, sources);

        for (Integer node : graph.nodes()) {
            Double best = null;
            for (Integer source : sources) {
                Double distance = BmsspPaths.multiSourcePathLengths(graph, List.of(source)).get(node);
                if (distance != null && (best == null || distance < best)) {
                    best = distance;
                }
            }
            assertEquals(best, combined.get(node), "distance of node " + node);
        }
        assertPathsConsistent(graph, BmsspPaths.bmssp(graph, sources));
    }

    @Test
    @DisplayName("Target queries agree with full searches on the target")
    void testTargetQueries() {
        AttributedGraph<Integer> graph = GraphFixtures.randomIntegerWeighted(400, 1600, 77L, 15);
        Map<Integer, Double> full = DijkstraPaths.dijkstra(graph, Set.of(0)).getDistances();

        for (int target = 1; target < 400; target += 13) {
            if (!full.containsKey(target)) {
                final int unreachable = target;
                assertThrows(NoPathException.class, () -> BmsspPaths.singleSourcePathLength(graph, 0, unreachable));
                continue;
            }
            assertEquals((double) full.get(target), BmsspPaths.singleSourcePathLength(graph, 0, target), "target " + target);
            List<Integer> path = BmsspPaths.singleSourcePath(graph, 0, target);
            assertEquals((double) full.get(target), pathWeight(graph, path), 1e-9, "path weight to " + target);
        }
    }

    private static void assertPathsConsistent(AttributedGraph<Integer> graph, ShortestPathResult<Integer> result) {
        assertEquals(result.getDistances().keySet(), result.getPaths().keySet());
        for (Map.Entry<Integer, List<Integer>> entry : result.getPaths().entrySet()) {
            List<Integer> path = entry.getValue();
            assertEquals(entry.getKey(), path.get(path.size() - 1));
            assertEquals((double) result.getDistances().get(entry.getKey()), pathWeight(graph, path), 1e-9,
                    "path to " + entry.getKey() + " must weigh its reported distance");
        }
    }

    private static double pathWeight(AttributedGraph<Integer> graph, List<Integer> path) {
        double total = 0.0d;
        for (int i = 0; i + 1 < path.size(); i++) {
            Object raw = graph.edgeAttributes(path.get(i), path.get(i + 1)).get(0).get("weight");
            total += ((Number) raw).doubleValue();
        }
        return total;
    }
}
