package org.pathlab.paths.core;

/**
 * Tuning constants of one BMSSP invocation, derived deterministically from graph size.
 *
 * @param k              pivot-finder round count and base-case pop quota.
 * @param t              recursion branching exponent.
 * @param depth          top recursion level {@code l}; 0 runs the base case directly.
 * @param counter        perturbation added on every relaxation.
 * @param edgeAdjustment per-edge identity step; edge {@code i} carries {@code i * edgeAdjustment}.
 */
public record BmsspParameters(int k, int t, int depth, double counter, double edgeAdjustment) {

    /**
     * Derives parameters for a graph with {@code nodeCount} nodes and {@code edgeCount} edges.
     *
     * <p>{@code nodeCount <= 1} forces {@code k = t = 1} and {@code depth = 0}.</p>
     *
     * @param precision number of decimals reported to the caller; scales both perturbations so
     *                  their total stays below the reported resolution.
     */
    public static BmsspParameters derive(int nodeCount, int edgeCount, int precision) {
        if (nodeCount < 0 || edgeCount < 0) {
            throw new IllegalArgumentException("nodeCount and edgeCount must be >= 0");
        }
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0, got " + precision);
        }

        int k = 1;
        int t = 1;
        int depth = 0;
        if (nodeCount > 1) {
            double log = log2(nodeCount);
            k = Math.max(1, (int) Math.floor(Math.cbrt(log)));
            t = Math.max(1, (int) Math.floor(Math.cbrt(log * log)));
            depth = (int) Math.ceil(log / t);
        }

        double scale = Math.pow(10.0d, precision + 1) * (2.0d * nodeCount + 1.0d);
        double counter = 1.0d / scale;
        double edgeAdjustment = 1.0d / (scale * (2.0d * edgeCount + 1.0d));
        return new BmsspParameters(k, t, depth, counter, edgeAdjustment);
    }

    /**
     * Base-2 logarithm, exact for powers of two.
     */
    static double log2(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive");
        }
        if ((n & (n - 1)) == 0) {
            return Integer.numberOfTrailingZeros(n);
        }
        return Math.log(n) / Math.log(2.0d);
    }
}
