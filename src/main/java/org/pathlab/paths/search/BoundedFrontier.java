package org.pathlab.paths.search;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Min-priority frontier of node indices keyed by perturbed distance.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>One entry per node:</strong> inserting a node that is already present keeps the
 * smaller key (Decrease-Key), so pulls never see stale duplicates.</li>
 * <li><strong>Group pull:</strong> {@link #pullMinGroup(IntArrayList)} removes every node that
 * shares the minimum key, so tied nodes are always handed out together.</li>
 * <li><strong>Batch prepend:</strong> {@link #batchPrepend(IntArrayList, DoubleArrayList)} inserts
 * a deferred batch whose keys sit below everything already queued.</li>
 * <li><strong>Sparse:</strong> position tracking is hashed, so one frontier per recursive call
 * costs memory proportional to its own contents, not to the graph.</li>
 * </ul>
 * Ties on key are broken by node index.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 */
public final class BoundedFrontier {

    private static final int DEFAULT_CAPACITY = 8;

    // Binary heap (1-based indexing for easier parent/child math)
    private int[] heapNodes;
    private double[] heapKeys;
    private int size = 0;

    // positions[node] = heap index; 0 means absent
    private final Int2IntOpenHashMap positions;

    BoundedFrontier() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param expectedSize initial capacity hint; the heap grows on demand.
     */
    public BoundedFrontier(int expectedSize) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must be non-negative");
        }
        int capacity = Math.max(DEFAULT_CAPACITY, expectedSize);
        this.heapNodes = new int[capacity + 1];
        this.heapKeys = new double[capacity + 1];
        this.positions = new Int2IntOpenHashMap(capacity);
        this.positions.defaultReturnValue(0);
    }

    /**
     * Inserts a node, or lowers its key when the node is already queued with a larger one.
     *
     * @param node node index, must be non-negative.
     * @param key  perturbed distance, must not be NaN.
     * @return true when the frontier changed.
     */
    public boolean insert(int node, double key) {
        if (node < 0) {
            throw new IllegalArgumentException("node " + node + " must be non-negative");
        }
        if (Double.isNaN(key)) {
            throw new IllegalArgumentException("key must not be NaN");
        }

        int existingIdx = positions.get(node);
        if (existingIdx > 0) {
            if (key < heapKeys[existingIdx]) {
                heapKeys[existingIdx] = key;
                swim(existingIdx);
                return true;
            }
            return false;
        }

        ensureCapacity(size + 1);
        size++;
        heapNodes[size] = node;
        heapKeys[size] = key;
        positions.put(node, size);
        swim(size);
        return true;
    }

    /**
     * Inserts a batch of nodes collected while the current pull was being processed.
     * <p>
     * Callers only defer keys that are strictly below the bound of the pull that produced
     * them, which places the whole batch ahead of every entry already queued.
     * </p>
     *
     * @param nodes node indices.
     * @param keys  keys aligned with {@code nodes}.
     */
    public void batchPrepend(IntArrayList nodes, DoubleArrayList keys) {
        if (nodes.size() != keys.size()) {
            throw new IllegalArgumentException(
                    "batch size mismatch: " + nodes.size() + " nodes, " + keys.size() + " keys"
            );
        }
        for (int i = 0; i < nodes.size(); i++) {
            insert(nodes.getInt(i), keys.getDouble(i));
        }
    }

    /**
     * Removes every node whose key equals the current minimum.
     *
     * @param out receives the removed nodes in ascending node order.
     * @return the minimum key shared by the removed nodes.
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public double pullMinGroup(IntArrayList out) {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }
        double minKey = heapKeys[1];
        while (size > 0 && Double.compare(heapKeys[1], minKey) == 0) {
            out.add(extractMinNode());
        }
        return minKey;
    }

    /**
     * Removes and returns the node with the smallest key.
     *
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public int extractMin() {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }
        return extractMinNode();
    }

    /**
     * Returns the smallest queued key without removing it.
     *
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public double peekMinKey() {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }
        return heapKeys[1];
    }

    /**
     * Removes a node if present.
     *
     * @return true when the node was queued.
     */
    public boolean remove(int node) {
        int idx = positions.remove(node);
        if (idx <= 0) {
            return false;
        }
        int lastIndex = size;
        size--;
        if (idx == lastIndex) {
            return true;
        }
        heapNodes[idx] = heapNodes[lastIndex];
        heapKeys[idx] = heapKeys[lastIndex];
        int moved = heapNodes[idx];
        positions.put(moved, idx);
        // The moved entry may need to go either way.
        swim(idx);
        if (positions.get(moved) == idx) {
            sink(idx);
        }
        return true;
    }

    boolean contains(int node) {
        return positions.get(node) > 0;
    }

    /**
     * Returns the queued key of a node.
     *
     * @throws IllegalArgumentException if the node is not queued.
     */
    double keyOf(int node) {
        int idx = positions.get(node);
        if (idx <= 0) {
            throw new IllegalArgumentException("node " + node + " is not queued");
        }
        return heapKeys[idx];
    }

    int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    void clear() {
        positions.clear();
        size = 0;
    }

    // --- Heap Helper Methods ---

    private int extractMinNode() {
        int min = heapNodes[1];
        positions.remove(min);
        int lastIndex = size;
        size = lastIndex - 1;
        if (lastIndex == 1) {
            return min;
        }

        heapNodes[1] = heapNodes[lastIndex];
        heapKeys[1] = heapKeys[lastIndex];
        positions.put(heapNodes[1], 1);
        sink(1);
        return min;
    }

    private void ensureCapacity(int required) {
        if (required < heapNodes.length) {
            return;
        }
        int newLength = Math.max(required + 1, heapNodes.length * 2);
        int[] nodes = new int[newLength];
        double[] keys = new double[newLength];
        System.arraycopy(heapNodes, 0, nodes, 0, size + 1);
        System.arraycopy(heapKeys, 0, keys, 0, size + 1);
        heapNodes = nodes;
        heapKeys = keys;
    }

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Returns whether heap index {@code i} has lower priority than index {@code j}.
     */
    private boolean greater(int i, int j) {
        int byKey = Double.compare(heapKeys[i], heapKeys[j]);
        if (byKey != 0) {
            return byKey > 0;
        }
        return heapNodes[i] > heapNodes[j];
    }

    private void swap(int i, int j) {
        int node = heapNodes[i];
        double key = heapKeys[i];
        heapNodes[i] = heapNodes[j];
        heapKeys[i] = heapKeys[j];
        heapNodes[j] = node;
        heapKeys[j] = key;

        positions.put(heapNodes[i], i);
        positions.put(heapNodes[j], j);
    }
}
