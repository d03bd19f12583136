package org.pathlab.paths.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.pathlab.paths.search.BoundedFrontier;

/**
 * Level-0 solver: Dijkstra from the given sources that stops after {@code k} completions.
 *
 * <p>Only candidates strictly below the bound are queued. Once {@code k} nodes are completed
 * the key of the next node becomes the returned bound; nodes tied with the last completed one
 * are completed as well, so the bound always lies strictly above every completed distance. When
 * the queue runs dry first, the incoming bound is returned unchanged.</p>
 */
final class BaseCaseSolver {
    private final SearchContext context;

    BaseCaseSolver(SearchContext context) {
        this.context = context;
    }

    BoundedResult solve(double bound, IntArrayList sources) {
        context.recordBaseCase();
        AdjacencySnapshot<?> graph = context.graph();
        int k = context.k();

        BoundedFrontier heap = new BoundedFrontier(k + 1);
        for (int i = 0; i < sources.size(); i++) {
            int source = sources.getInt(i);
            heap.insert(source, context.dist(source));
        }

        IntOpenHashSet settled = new IntOpenHashSet();
        IntArrayList completed = new IntArrayList();
        double lastKey = Double.NEGATIVE_INFINITY;

        while (!heap.isEmpty()) {
            double key = heap.peekMinKey();
            if (completed.size() >= k && key > lastKey) {
                return new BoundedResult(key, completed);
            }
            int u = heap.extractMin();
            settled.add(u);
            completed.add(u);
            lastKey = key;

            int end = graph.firstEdge(u + 1);
            for (int slot = graph.firstEdge(u); slot < end; slot++) {
                int v = graph.edgeTarget(slot);
                if (settled.contains(v)) {
                    continue;
                }
                double candidate = context.candidate(u, slot);
                if (candidate < bound && context.tryRelax(u, slot, candidate)) {
                    heap.insert(v, candidate);
                }
            }
        }
        return new BoundedResult(bound, completed);
    }
}
