package org.pathlab.paths.core;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.pathlab.core.id.NodeIndexMapper;
import org.pathlab.graph.Edge;
import org.pathlab.graph.Graph;
import org.pathlab.paths.weight.WeightResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense, index-based copy of a directed graph taken once per search.
 * <p>
 * Layout:
 * - Nodes are numbered {@code 0..n-1} in the graph's node order.
 * - CSR (Compressed Sparse Row): outgoing edges of node {@code u} occupy slots
 *   {@code [firstEdge(u), firstEdge(u + 1))}.
 * - SoA edge properties: target, resolved weight, and a tie-break identity that grows
 *   strictly with the slot number.
 * <p>
 * Hidden edges and edges of infinite weight are left out. Parallel edges are already
 * collapsed to one slot per ordered pair by the {@link WeightResolver}.
 *
 * @param <N> node label type.
 */
public final class AdjacencySnapshot<N> {

    @Getter
    @Accessors(fluent = true)
    private final NodeIndexMapper<N> nodeIndex;

    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final double[] edgeWeight;
    private final double[] edgeIdentity;

    private AdjacencySnapshot(
            NodeIndexMapper<N> nodeIndex,
            int[] firstEdge,
            int[] edgeTarget,
            double[] edgeWeight,
            double[] edgeIdentity
    ) {
        this.nodeIndex = nodeIndex;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;
        this.edgeIdentity = edgeIdentity;
    }

    /**
     * Snapshots {@code graph}, resolving every edge weight exactly once.
     *
     * @param edgeAdjustment identity step per slot; 0 disables tie-break identities.
     * @throws org.pathlab.paths.weight.InvalidWeightException on a negative or NaN weight.
     */
    public static <N> AdjacencySnapshot<N> build(
            Graph<N> graph,
            WeightResolver<N> weights,
            double edgeAdjustment
    ) {
        NodeIndexMapper<N> nodeIndex = NodeIndexMapper.inInsertionOrder(graph.nodes());
        int nodeCount = nodeIndex.size();

        List<IntArrayList> targets = new ArrayList<>(nodeCount);
        List<DoubleArrayList> costs = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            targets.add(new IntArrayList());
            costs.add(new DoubleArrayList());
        }

        if (graph.isMultigraph()) {
            collectParallel(graph, weights, nodeIndex, targets, costs);
        } else {
            for (Edge<N> edge : graph.edges()) {
                Double weight = weights.edgeWeight(edge.source(), edge.target(), edge.attributes());
                append(nodeIndex, edge.source(), edge.target(), weight, targets, costs);
            }
        }

        int[] firstEdge = new int[nodeCount + 1];
        int slots = 0;
        for (int u = 0; u < nodeCount; u++) {
            firstEdge[u] = slots;
            slots += targets.get(u).size();
        }
        firstEdge[nodeCount] = slots;

        int[] edgeTarget = new int[slots];
        double[] edgeWeight = new double[slots];
        double[] edgeIdentity = new double[slots];
        for (int u = 0; u < nodeCount; u++) {
            IntArrayList out = targets.get(u);
            DoubleArrayList outCosts = costs.get(u);
            int base = firstEdge[u];
            for (int i = 0; i < out.size(); i++) {
                int slot = base + i;
                edgeTarget[slot] = out.getInt(i);
                edgeWeight[slot] = outCosts.getDouble(i);
                edgeIdentity[slot] = slot * edgeAdjustment;
            }
        }
        return new AdjacencySnapshot<>(nodeIndex, firstEdge, edgeTarget, edgeWeight, edgeIdentity);
    }

    private static <N> void collectParallel(
            Graph<N> graph,
            WeightResolver<N> weights,
            NodeIndexMapper<N> nodeIndex,
            List<IntArrayList> targets,
            List<DoubleArrayList> costs
    ) {
        Map<N, LinkedHashMap<N, List<Map<String, Object>>>> grouped = new LinkedHashMap<>();
        for (Edge<N> edge : graph.edges()) {
            grouped.computeIfAbsent(edge.source(), ignored -> new LinkedHashMap<>())
                    .computeIfAbsent(edge.target(), ignored -> new ArrayList<>(2))
                    .add(edge.attributes());
        }
        for (Map.Entry<N, LinkedHashMap<N, List<Map<String, Object>>>> out : grouped.entrySet()) {
            for (Map.Entry<N, List<Map<String, Object>>> pair : out.getValue().entrySet()) {
                Double weight = weights.pairWeight(out.getKey(), pair.getKey(), pair.getValue());
                append(nodeIndex, out.getKey(), pair.getKey(), weight, targets, costs);
            }
        }
    }

    private static <N> void append(
            NodeIndexMapper<N> nodeIndex,
            N source,
            N target,
            Double weight,
            List<IntArrayList> targets,
            List<DoubleArrayList> costs
    ) {
        if (weight == null || weight == Double.POSITIVE_INFINITY) {
            return;
        }
        int u = nodeIndex.toIndex(source);
        targets.get(u).add(nodeIndex.toIndex(target));
        costs.get(u).add(weight.doubleValue());
    }

    public int nodeCount() {
        return firstEdge.length - 1;
    }

    /**
     * Returns the number of stored edge slots.
     */
    public int edgeCount() {
        return edgeTarget.length;
    }

    /**
     * First outgoing slot of {@code node}; the node's slots end at {@code firstEdge(node + 1)}.
     */
    public int firstEdge(int node) {
        return firstEdge[node];
    }

    public int edgeTarget(int slot) {
        return edgeTarget[slot];
    }

    public double edgeWeight(int slot) {
        return edgeWeight[slot];
    }

    public double edgeIdentity(int slot) {
        return edgeIdentity[slot];
    }
}
