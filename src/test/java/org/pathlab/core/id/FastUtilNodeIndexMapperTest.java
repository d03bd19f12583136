package org.pathlab.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilNodeIndexMapperTest {

    @Test
    @DisplayName("Baseline Correctness: indices follow insertion order")
    void testInsertionOrder() {
        NodeIndexMapper<String> mapper = NodeIndexMapper.inInsertionOrder(List.of("NewYork", "LosAngeles", "Chicago"));

        assertEquals(0, mapper.toIndex("NewYork"));
        assertEquals(2, mapper.toIndex("Chicago"));
        assertEquals("LosAngeles", mapper.toLabel(1));

        assertTrue(mapper.containsLabel("Chicago"));
        assertFalse(mapper.containsLabel("Miami"));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Round trip over every index")
    void testRoundTrip() {
        List<Integer> labels = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            labels.add(i * 7 + 3);
        }
        NodeIndexMapper<Integer> mapper = new FastUtilNodeIndexMapper<>(labels);
        for (int i = 0; i < labels.size(); i++) {
            assertEquals(i, mapper.toIndex(mapper.toLabel(i)));
        }
    }

    @Test
    @DisplayName("Exception Path: unknown label")
    void testUnknownLabel() {
        NodeIndexMapper<String> mapper = NodeIndexMapper.inInsertionOrder(List.of("A"));

        assertThrows(NodeIndexMapper.UnknownNodeException.class, () -> mapper.toIndex("Atlantis"),
                "Should throw UnknownNodeException for missing labels");
    }

    @Test
    @DisplayName("Exception Path: index out of range")
    void testInvalidIndex() {
        NodeIndexMapper<String> mapper = NodeIndexMapper.inInsertionOrder(List.of("A", "B"));

        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toLabel(2));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toLabel(-1));
    }

    @Test
    @DisplayName("Validation: null, duplicate and null-collection input")
    void testRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilNodeIndexMapper<String>(null));
        assertThrows(IllegalArgumentException.class,
                () -> new FastUtilNodeIndexMapper<>(Arrays.asList("A", null)));
        assertThrows(IllegalArgumentException.class,
                () -> new FastUtilNodeIndexMapper<>(List.of("A", "B", "A")));
    }

    @Test
    @DisplayName("Empty mapping")
    void testEmpty() {
        NodeIndexMapper<String> mapper = NodeIndexMapper.inInsertionOrder(List.of());
        assertEquals(0, mapper.size());
        assertFalse(mapper.containsLabel("A"));
    }
}
