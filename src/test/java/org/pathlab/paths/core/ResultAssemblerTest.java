package org.pathlab.paths.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pathlab.graph.AttributedGraph;
import org.pathlab.paths.weight.WeightResolver;
import org.pathlab.paths.weight.WeightSpec;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultAssemblerTest {

    @ParameterizedTest(name = "round({0}, {1}) = {2}")
    @CsvSource({
            "2.5, 0, 2.0",
            "3.5, 0, 4.0",
            "2.675, 2, 2.67",
            "1.00001, 3, 1.0",
            "7.0, 0, 7.0"
    })
    @DisplayName("Rounds half-even on the exact binary value")
    void testRound(double value, int precision, double expected) {
        assertEquals(expected, ResultAssembler.round(value, precision));
    }

    @Test
    @DisplayName("Unreached nodes are excluded and paths follow predecessors")
    void testAssemble() {
        AttributedGraph<String> graph = AttributedGraph.<String>directed()
                .addWeightedEdge("s", "a", 1)
                .addWeightedEdge("a", "b", 1)
                .addNode("island");
        AdjacencySnapshot<String> snapshot = AdjacencySnapshot.build(
                graph, WeightResolver.of(WeightSpec.defaultWeight()), 0.0d);

        double inf = Double.POSITIVE_INFINITY;
        SearchOutcome outcome = new SearchOutcome(
                new double[]{0.0d, 1.1d, 2.2d, inf},
                new double[]{0.0d, 1.0d, 2.0d, inf},
                new int[]{-1, 0, 1, -1},
                null
        );

        ShortestPathResult<String> result = ResultAssembler.assemble(snapshot, outcome, 0);

        assertEquals(Map.of("s", 0.0d, "a", 1.0d, "b", 2.0d), result.getDistances());
        assertEquals(List.of("s", "a", "b"), result.getPaths().get("b"));
        assertEquals(List.of("s"), result.getPaths().get("s"));
        assertFalse(result.isReachable("island"));
        assertEquals(List.of("s", "a", "b"), List.copyOf(result.getDistances().keySet()));
    }

    @Test
    @DisplayName("Predecessor cycles are reported instead of looping")
    void testPredecessorCycle() {
        AttributedGraph<Integer> graph = AttributedGraph.<Integer>directed().addEdge(0, 1).addEdge(1, 0);
        AdjacencySnapshot<Integer> snapshot = AdjacencySnapshot.build(
                graph, WeightResolver.of(WeightSpec.defaultWeight()), 0.0d);
        SearchOutcome broken = new SearchOutcome(new double[]{1, 1}, new double[]{1, 1}, new int[]{1, 0}, null);

        assertThrows(IllegalStateException.class, () -> ResultAssembler.assemble(snapshot, broken, 0));
    }
}
