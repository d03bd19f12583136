package org.pathlab.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;

/**
 * Bidirectional mapping contract between caller node labels and dense integer indices.
 *
 * @param <N> node label type.
 */
public interface NodeIndexMapper<N> {

    /**
     * Converts a node label to its dense index.
     * @param label The caller-facing node label.
     * @return The internal index in {@code [0, size)}.
     * @throws UnknownNodeException If the label is not mapped.
     */
    int toIndex(N label) throws UnknownNodeException;

    /**
     * Converts a dense index back to its node label.
     * @param index The internal index.
     * @return The caller-facing node label.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    N toLabel(int index);

    /**
     * Checks whether a label has a mapped index.
     *
     * @param label label to test.
     * @return true when the label is present.
     */
    boolean containsLabel(N label);

    /**
     * Returns number of label/index pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when a node label cannot be found in the mapping.
     */
    @StandardException
    class UnknownNodeException extends RuntimeException {
    }

    /**
     * Creates the default immutable mapping, assigning indices in iteration order.
     *
     * @param labels distinct node labels; the first label gets index 0.
     * @param <N> node label type.
     * @return an immutable mapper.
     */
    static <N> NodeIndexMapper<N> inInsertionOrder(Collection<N> labels) {
        return new FastUtilNodeIndexMapper<>(labels);
    }
}
