package org.pathlab.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;

/**
 * Immutable {@link NodeIndexMapper} backed by fastutil.
 * <p>
 * Forward lookups avoid boxing through {@link Object2IntOpenHashMap#getInt(Object)};
 * reverse lookups are plain array reads. Safe for concurrent reads once built.
 *
 * @param <N> node label type.
 */
public final class FastUtilNodeIndexMapper<N> implements NodeIndexMapper<N> {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<N> forward;
    private final Object[] reverse;

    /**
     * Builds the mapping from labels in iteration order.
     *
     * @param labels distinct, non-null node labels.
     * @throws IllegalArgumentException if labels is null, holds null or holds duplicates.
     */
    public FastUtilNodeIndexMapper(Collection<N> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("Labels cannot be null");
        }
        int size = labels.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new Object[size];

        int next = 0;
        for (N label : labels) {
            if (label == null) {
                throw new IllegalArgumentException("Node labels must be non-null");
            }
            if (forward.containsKey(label)) {
                throw new IllegalArgumentException("Duplicate node label detected: " + label);
            }
            forward.put(label, next);
            reverse[next] = label;
            next++;
        }

        this.forward.trim();
    }

    @Override
    public int toIndex(N label) throws UnknownNodeException {
        int index = forward.getInt(label);
        if (index == MISSING) {
            throw new UnknownNodeException("Node not found: " + label);
        }
        return index;
    }

    @Override
    @SuppressWarnings("unchecked")
    public N toLabel(int index) {
        try {
            return (N) reverse[index];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Node index out of bounds: " + index);
        }
    }

    @Override
    public boolean containsLabel(N label) {
        return forward.containsKey(label);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
