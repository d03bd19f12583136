package org.pathlab.paths.core;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded Bellman-Ford expansion that shrinks a source set to its pivots.
 *
 * <p>Runs at most {@code k} relaxation rounds from the sources, keeping only nodes below the
 * bound. If the explored set grows past {@code k * |S|} every source stays a pivot. Otherwise
 * a source is a pivot when it roots a tree of at least {@code k} nodes in the forest formed by
 * predecessor links inside the explored set. Trees of different roots are disjoint, so each is
 * walked once.</p>
 */
final class PivotFinder {
    private static final Logger log = LoggerFactory.getLogger(PivotFinder.class);

    private final SearchContext context;

    PivotFinder(SearchContext context) {
        this.context = context;
    }

    PivotSelection find(double bound, IntArrayList sources) {
        AdjacencySnapshot<?> graph = context.graph();
        int k = context.k();
        long wideLimit = (long) k * sources.size();

        IntOpenHashSet exploredSet = new IntOpenHashSet(sources);
        IntArrayList explored = new IntArrayList(sources);
        IntArrayList layer = new IntArrayList(sources);

        for (int round = 0; round < k; round++) {
            IntArrayList next = new IntArrayList();
            IntOpenHashSet nextSet = new IntOpenHashSet();
            for (int i = 0; i < layer.size(); i++) {
                int u = layer.getInt(i);
                if (!(context.dist(u) < bound)) {
                    continue;
                }
                int end = graph.firstEdge(u + 1);
                for (int slot = graph.firstEdge(u); slot < end; slot++) {
                    if (!context.relax(u, slot)) {
                        continue;
                    }
                    int v = graph.edgeTarget(slot);
                    if (context.dist(v) < bound) {
                        if (nextSet.add(v)) {
                            next.add(v);
                        }
                        if (exploredSet.add(v)) {
                            explored.add(v);
                        }
                    }
                }
            }
            if (explored.size() > wideLimit) {
                context.recordPivotSearch(true, sources.size());
                log.trace("pivot search wide: |S|={} |W|={} bound={}", sources.size(), explored.size(), bound);
                return new PivotSelection(new IntArrayList(sources), explored, true);
            }
            if (next.isEmpty()) {
                break;
            }
            layer = next;
        }

        Int2ObjectOpenHashMap<IntArrayList> children = new Int2ObjectOpenHashMap<>();
        for (int i = 0; i < explored.size(); i++) {
            int v = explored.getInt(i);
            int parent = context.pred(v);
            if (parent != SearchContext.NO_PREDECESSOR && parent != v && exploredSet.contains(parent)) {
                IntArrayList below = children.get(parent);
                if (below == null) {
                    below = new IntArrayList();
                    children.put(parent, below);
                }
                below.add(v);
            }
        }

        IntArrayList pivots = new IntArrayList();
        for (int i = 0; i < sources.size(); i++) {
            int root = sources.getInt(i);
            int parent = context.pred(root);
            if (parent != SearchContext.NO_PREDECESSOR && exploredSet.contains(parent)) {
                continue;
            }
            if (treeReaches(root, children, k)) {
                pivots.add(root);
            }
        }
        context.recordPivotSearch(false, pivots.size());
        log.trace("pivot search: |S|={} |W|={} |P|={} bound={}", sources.size(), explored.size(), pivots.size(), bound);
        return new PivotSelection(pivots, explored, false);
    }

    /**
     * Returns whether the forest tree under {@code root} holds at least {@code k} nodes.
     */
    private static boolean treeReaches(int root, Int2ObjectOpenHashMap<IntArrayList> children, int k) {
        IntArrayList stack = new IntArrayList();
        IntOpenHashSet seen = new IntOpenHashSet();
        stack.add(root);
        seen.add(root);
        int count = 0;
        while (!stack.isEmpty() && count < k) {
            int node = stack.popInt();
            count++;
            IntArrayList below = children.get(node);
            if (below == null) {
                continue;
            }
            for (int i = 0; i < below.size(); i++) {
                int child = below.getInt(i);
                if (seen.add(child)) {
                    stack.add(child);
                }
            }
        }
        return count >= k;
    }
}
