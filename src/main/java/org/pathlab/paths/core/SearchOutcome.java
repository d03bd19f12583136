package org.pathlab.paths.core;

/**
 * Raw per-index output of a completed search, before labels and rounding are applied.
 *
 * @param distances         search distances; {@code +Infinity} marks an unreached node.
 * @param reportedDistances clean weight sums reported to callers.
 * @param predecessors      predecessor index per node, {@code -1} for sources and unreached nodes.
 * @param stats             work counters, or {@code null} when the algorithm does not collect them.
 */
public record SearchOutcome(
        double[] distances,
        double[] reportedDistances,
        int[] predecessors,
        BmsspExecutionStats stats
) {
}
