package org.pathlab.paths.search;

/**
 * Thrown when attempting to read or pull from an empty {@link BoundedFrontier}.
 */
public class EmptyFrontierException extends IllegalStateException {
    public EmptyFrontierException(String message) {
        super(message);
    }
}
