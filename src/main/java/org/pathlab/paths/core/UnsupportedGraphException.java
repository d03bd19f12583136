package org.pathlab.paths.core;

/**
 * Thrown for graph kinds the algorithms are not defined on. Only undirected graphs today.
 */
public final class UnsupportedGraphException extends ShortestPathException {

    public UnsupportedGraphException(String message) {
        super(Reason.UNDIRECTED_GRAPH, message);
    }
}
