package org.pathlab.paths;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.pathlab.graph.AttributedGraph;
import org.pathlab.paths.core.NoPathException;
import org.pathlab.paths.core.NodeNotFoundException;
import org.pathlab.paths.core.ShortestPathResult;
import org.pathlab.paths.core.UnsupportedGraphException;
import org.pathlab.paths.testutil.GraphFixtures;
import org.pathlab.paths.weight.WeightSpec;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DijkstraPathsTest {

    @Test
    @DisplayName("Triangle: distances and path")
    void testTriangle() {
        ShortestPathResult<Integer> result = DijkstraPaths.dijkstra(GraphFixtures.triangle(), Set.of(0));

        assertEquals(Map.of(0, 0.0d, 1, 1.0d, 2, 3.0d), result.getDistances());
        assertEquals(List.of(0, 1, 2), result.getPaths().get(2));
        assertNull(result.getStats());
    }

    @Test
    @DisplayName("pathLength is unrounded")
    void testPathLength() {
        AttributedGraph<String> graph = AttributedGraph.<String>directed()
                .addWeightedEdge("A", "B", 0.1)
                .addWeightedEdge("B", "C", 0.2);

        assertEquals(0.1d + 0.2d, DijkstraPaths.pathLength(graph, "A", "C"));
        assertEquals(List.of("A", "B", "C"), DijkstraPaths.path(graph, "A", "C"));
    }

    @Test
    @DisplayName("Custom weights and hidden edges")
    void testCustomWeight() {
        AttributedGraph<Integer> graph = AttributedGraph.<Integer>directed()
                .addEdge(0, 1, Map.of("cost", 4))
                .addEdge(0, 2, Map.of("cost", 1))
                .addEdge(2, 1, Map.of("cost", 1, "closed", true));
        WeightSpec<Integer> openCost = WeightSpec.function(
                (u, v, d) -> d.containsKey("closed") ? null : (Number) d.get("cost"));

        assertEquals(4.0d, DijkstraPaths.pathLength(graph, 0, 1, openCost));
    }

    @Test
    @DisplayName("Failures mirror the BMSSP contract")
    void testFailures() {
        AttributedGraph<Integer> disconnected = AttributedGraph.<Integer>directed().addNode(0).addNode(1);
        assertThrows(NoPathException.class, () -> DijkstraPaths.pathLength(disconnected, 0, 1));
        assertThrows(NoPathException.class, () -> DijkstraPaths.path(disconnected, 0, 1));
        assertThrows(NodeNotFoundException.class, () -> DijkstraPaths.pathLength(disconnected, 0, 5));
        assertThrows(UnsupportedGraphException.class,
                () -> DijkstraPaths.dijkstra(AttributedGraph.<Integer>undirected().addEdge(0, 1), Set.of(0)));
        assertThrows(IllegalArgumentException.class, () -> DijkstraPaths.dijkstra(GraphFixtures.triangle(), Set.of()));
    }
}
