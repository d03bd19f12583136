package org.pathlab.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphGeneratorsTest {

    @Test
    @DisplayName("pathGraph builds an undirected chain")
    void testPathGraph() {
        AttributedGraph<Integer> graph = GraphGenerators.pathGraph(5);

        assertFalse(graph.isDirected());
        assertEquals(5, graph.nodeCount());
        assertEquals(4, graph.edgeCount());
        assertTrue(graph.containsEdge(3, 2));
    }

    @Test
    @DisplayName("addCycle closes the loop")
    void testAddCycle() {
        AttributedGraph<Integer> graph = GraphGenerators.addCycle(AttributedGraph.directed(), 0, 1, 2, 3);

        assertEquals(4, graph.edgeCount());
        assertTrue(graph.containsEdge(3, 0));
        assertFalse(graph.containsEdge(0, 3));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 123L})
    @DisplayName("gnmRandomGraph is deterministic per seed")
    void testGnmDeterministic(long seed) {
        AttributedGraph<Integer> first = GraphGenerators.gnmRandomGraph(50, 150, seed, true);
        AttributedGraph<Integer> second = GraphGenerators.gnmRandomGraph(50, 150, seed, true);

        assertEquals(150, first.edgeCount());
        assertEquals(edgeList(first), edgeList(second));
        for (Edge<Integer> edge : first.edges()) {
            assertNotEquals(edge.source(), edge.target(), "No self loops expected");
        }
    }

    @Test
    @DisplayName("gnmRandomGraph rejects impossible edge counts")
    void testGnmTooManyEdges() {
        assertThrows(IllegalArgumentException.class, () -> GraphGenerators.gnmRandomGraph(3, 7, 1L, true));
        assertThrows(IllegalArgumentException.class, () -> GraphGenerators.gnmRandomGraph(3, 4, 1L, false));
    }

    private static List<String> edgeList(Graph<Integer> graph) {
        List<String> out = new ArrayList<>();
        for (Edge<Integer> edge : graph.edges()) {
            out.add(edge.source() + "->" + edge.target());
        }
        return out;
    }
}
