package org.pathlab.paths.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Shortest Path Exception Tests")
class ShortestPathExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessagePrefix() {
        NoPathException ex = new NoPathException(7, "[0]");

        assertEquals(ShortestPathException.Reason.NO_PATH, ex.getReason());
        assertEquals("[BMSSP_NO_PATH] Node 7 not reachable from [0]", ex.getMessage());
    }

    @Test
    @DisplayName("Each subclass reports its own reason")
    void testSubclassReasons() {
        assertEquals("BMSSP_NODE_NOT_FOUND", new NodeNotFoundException("x").getReasonCode());
        assertEquals("BMSSP_UNDIRECTED_GRAPH", new UnsupportedGraphException("undirected").getReasonCode());
    }

    @Test
    @DisplayName("Cause is kept")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");

        NodeNotFoundException ex = new NodeNotFoundException("x", cause);

        assertSame(cause, ex.getCause());
        assertNull(new NodeNotFoundException("y").getCause());
    }

    @Test
    @DisplayName("Reason is required")
    void testNullReason() {
        assertThrows(NullPointerException.class, () -> new ShortestPathException(null, "message"));
    }
}
