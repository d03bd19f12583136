package org.pathlab.paths.core;

/**
 * Thrown when the target cannot be reached from any source.
 */
public final class NoPathException extends ShortestPathException {

    public NoPathException(Object target, Object sources) {
        super(Reason.NO_PATH, "Node " + target + " not reachable from " + sources);
    }
}
