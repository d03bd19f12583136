package org.pathlab.paths.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;
import java.util.Objects;

/**
 * Mutable state of one top-level BMSSP call, shared by reference with every recursive level.
 *
 * <p>Holds the perturbed distances ({@code dist}), the clean weight sums ({@code cdist}), the
 * predecessor array and the work counters. Every distance write goes through
 * {@link #tryRelax(int, int, double)}, which never raises a value. Confined to the calling
 * thread; a new context is created per call.</p>
 */
final class SearchContext {
    static final int NO_PREDECESSOR = -1;
    static final int NO_TARGET = -1;

    private final AdjacencySnapshot<?> graph;
    private final BmsspParameters parameters;
    private final BmsspSearchBudget budget;
    private final int target;

    private final double[] dist;
    private final double[] cleanDist;
    private final int[] pred;

    private boolean targetReached;

    private long recursiveCalls;
    private long baseCaseCalls;
    private long pivotSearches;
    private long widePivotSearches;
    private long pivotsSelected;
    private long frontierPulls;
    private long relaxations;

    SearchContext(AdjacencySnapshot<?> graph, BmsspParameters parameters, int target, BmsspSearchBudget budget) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.target = target;

        int nodeCount = graph.nodeCount();
        this.dist = new double[nodeCount];
        this.cleanDist = new double[nodeCount];
        this.pred = new int[nodeCount];
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        Arrays.fill(cleanDist, Double.POSITIVE_INFINITY);
        Arrays.fill(pred, NO_PREDECESSOR);
    }

    AdjacencySnapshot<?> graph() {
        return graph;
    }

    int k() {
        return parameters.k();
    }

    /**
     * Marks a node as a search root at distance 0.
     */
    void seedSource(int node) {
        dist[node] = 0.0d;
        cleanDist[node] = 0.0d;
        pred[node] = NO_PREDECESSOR;
    }

    double dist(int node) {
        return dist[node];
    }

    double cleanDist(int node) {
        return cleanDist[node];
    }

    int pred(int node) {
        return pred[node];
    }

    /**
     * Returns the perturbed distance {@code node} would get through edge {@code slot} of {@code from}.
     */
    double candidate(int from, int slot) {
        return dist[from] + graph.edgeWeight(slot) + parameters.counter() + graph.edgeIdentity(slot);
    }

    /**
     * Relaxes edge {@code slot} of {@code from}.
     *
     * @return true when the edge target now points at {@code from}.
     */
    boolean relax(int from, int slot) {
        return tryRelax(from, slot, candidate(from, slot));
    }

    /**
     * Applies a precomputed candidate when it improves the target's current distance. An equal
     * candidate is accepted only from the current predecessor, so a completed node can re-announce
     * its out-neighbours while a tie never re-points a node and the predecessor graph stays a forest.
     */
    boolean tryRelax(int from, int slot, double candidate) {
        int to = graph.edgeTarget(slot);
        if (!(candidate < dist[to] || (candidate == dist[to] && pred[to] == from))) {
            return false;
        }
        dist[to] = candidate;
        cleanDist[to] = cleanDist[from] + graph.edgeWeight(slot);
        pred[to] = from;
        relaxations++;
        return true;
    }

    boolean hasTarget() {
        return target != NO_TARGET;
    }

    boolean targetReached() {
        return targetReached;
    }

    /**
     * Flags the target as reached when {@code completed} contains it.
     */
    void observeCompleted(IntArrayList completed) {
        if (!targetReached && target != NO_TARGET && completed.contains(target)) {
            targetReached = true;
        }
    }

    void markTargetReached() {
        targetReached = true;
    }

    void recordRecursiveCall() {
        recursiveCalls++;
    }

    void recordBaseCase() {
        baseCaseCalls++;
    }

    void recordPivotSearch(boolean wide, int pivots) {
        pivotSearches++;
        if (wide) {
            widePivotSearches++;
        }
        pivotsSelected += pivots;
    }

    /**
     * Counts one frontier pull and enforces the configured budget.
     */
    void recordFrontierPull() {
        frontierPulls++;
        budget.checkFrontierPulls(frontierPulls);
    }

    double[] distances() {
        return dist;
    }

    double[] cleanDistances() {
        return cleanDist;
    }

    int[] predecessors() {
        return pred;
    }

    BmsspExecutionStats stats() {
        return BmsspExecutionStats.builder()
                .k(parameters.k())
                .t(parameters.t())
                .depth(parameters.depth())
                .recursiveCalls(recursiveCalls)
                .baseCaseCalls(baseCaseCalls)
                .pivotSearches(pivotSearches)
                .widePivotSearches(widePivotSearches)
                .pivotsSelected(pivotsSelected)
                .frontierPulls(frontierPulls)
                .relaxations(relaxations)
                .stoppedAtTarget(targetReached)
                .build();
    }
}
