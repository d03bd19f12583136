package org.pathlab.paths.core;

/**
 * Thrown when a requested source or target node is not part of the graph.
 */
public final class NodeNotFoundException extends ShortestPathException {

    public NodeNotFoundException(Object node) {
        this(node, null);
    }

    public NodeNotFoundException(Object node, Throwable cause) {
        super(Reason.NODE_NOT_FOUND, "Node " + node + " not found in graph", cause);
    }
}
