package org.pathlab.paths.core;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.pathlab.paths.search.BoundedFrontier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Recursive bounded multi-source shortest-path driver.
 *
 * <p>Each level above zero shrinks its sources to pivots, then repeatedly pulls the group of
 * frontier nodes tied at the smallest key and solves that group one level down, bounded by the
 * next frontier key. Neighbours of completed nodes go back into the frontier: keys at or above
 * the sub-call bound are inserted directly, keys between the sub-call's completion bound and its
 * bound are batch-prepended together with the pulled nodes that did not complete. When the
 * frontier is exhausted the explored nodes below the bound are folded into the completed set.</p>
 *
 * <p>With a target the search returns as soon as a completed set contains it; distances of other
 * nodes are then upper bounds.</p>
 */
public final class BmsspSolver {
    private static final Logger log = LoggerFactory.getLogger(BmsspSolver.class);

    public static final int NO_TARGET = SearchContext.NO_TARGET;

    private final SearchContext context;
    private final PivotFinder pivotFinder;
    private final BaseCaseSolver baseCase;

    BmsspSolver(SearchContext context) {
        this.context = context;
        this.pivotFinder = new PivotFinder(context);
        this.baseCase = new BaseCaseSolver(context);
    }

    /**
     * Runs one top-level search over {@code graph}.
     *
     * @param sources distinct source indices, non-empty.
     * @param target  target index, or {@link #NO_TARGET}.
     * @throws ShortestPathException with {@link ShortestPathException.Reason#SEARCH_BUDGET_EXCEEDED} when the budget runs out.
     */
    public static SearchOutcome run(
            AdjacencySnapshot<?> graph,
            BmsspParameters parameters,
            IntArrayList sources,
            int target,
            BmsspSearchBudget budget
    ) {
        Objects.requireNonNull(sources, "sources");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("sources must be non-empty");
        }
        SearchContext context = new SearchContext(graph, parameters, target, budget);
        for (int i = 0; i < sources.size(); i++) {
            context.seedSource(sources.getInt(i));
        }

        if (context.hasTarget() && sources.contains(target)) {
            context.markTargetReached();
        } else {
            BmsspSolver solver = new BmsspSolver(context);
            try {
                solver.solve(parameters.depth(), Double.POSITIVE_INFINITY, sources);
            } catch (BmsspSearchBudget.BudgetExceededException ex) {
                throw new ShortestPathException(ShortestPathException.Reason.SEARCH_BUDGET_EXCEEDED, ex.getMessage(), ex);
            }
        }

        BmsspExecutionStats stats = context.stats();
        log.debug("bmssp finished: recursiveCalls={} baseCases={} pulls={} relaxations={} stoppedAtTarget={}",
                stats.getRecursiveCalls(), stats.getBaseCaseCalls(), stats.getFrontierPulls(),
                stats.getRelaxations(), stats.isStoppedAtTarget());
        return new SearchOutcome(
                context.distances(),
                context.cleanDistances(),
                context.predecessors(),
                stats
        );
    }

    /**
     * Solves the bounded sub-problem for {@code sources} at {@code level}.
     */
    BoundedResult solve(int level, double bound, IntArrayList sources) {
        context.recordRecursiveCall();
        if (level == 0) {
            BoundedResult result = baseCase.solve(bound, sources);
            log.trace("base case: |S|={} bound={} -> bound={} |U|={}",
                    sources.size(), bound, result.bound(), result.completed().size());
            return result;
        }

        PivotSelection selection = pivotFinder.find(bound, sources);
        AdjacencySnapshot<?> graph = context.graph();

        BoundedFrontier frontier = new BoundedFrontier(Math.max(16, selection.pivots().size()));
        IntArrayList pivots = selection.pivots();
        for (int i = 0; i < pivots.size(); i++) {
            int pivot = pivots.getInt(i);
            frontier.insert(pivot, context.dist(pivot));
        }

        IntArrayList completed = new IntArrayList();
        IntOpenHashSet completedSet = new IntOpenHashSet();
        IntArrayList pulled = new IntArrayList();
        IntArrayList deferredNodes = new IntArrayList();
        DoubleArrayList deferredKeys = new DoubleArrayList();

        while (!frontier.isEmpty()) {
            pulled.clear();
            frontier.pullMinGroup(pulled);
            context.recordFrontierPull();
            double subBound = frontier.isEmpty() ? bound : Math.min(frontier.peekMinKey(), bound);

            BoundedResult sub = solve(level - 1, subBound, pulled);
            IntArrayList subCompleted = sub.completed();
            for (int i = 0; i < subCompleted.size(); i++) {
                int u = subCompleted.getInt(i);
                if (completedSet.add(u)) {
                    completed.add(u);
                }
                frontier.remove(u);
            }

            deferredNodes.clear();
            deferredKeys.clear();
            for (int i = 0; i < subCompleted.size(); i++) {
                int u = subCompleted.getInt(i);
                int end = graph.firstEdge(u + 1);
                for (int slot = graph.firstEdge(u); slot < end; slot++) {
                    if (!context.relax(u, slot)) {
                        continue;
                    }
                    int v = graph.edgeTarget(slot);
                    double key = context.dist(v);
                    if (key >= subBound && key < bound) {
                        frontier.insert(v, key);
                    } else if (key >= sub.bound() && key < subBound) {
                        deferredNodes.add(v);
                        deferredKeys.add(key);
                    }
                }
            }
            for (int i = 0; i < pulled.size(); i++) {
                int x = pulled.getInt(i);
                double key = context.dist(x);
                if (key >= sub.bound() && key < subBound) {
                    deferredNodes.add(x);
                    deferredKeys.add(key);
                }
            }
            frontier.batchPrepend(deferredNodes, deferredKeys);

            context.observeCompleted(subCompleted);
            if (context.targetReached()) {
                return new BoundedResult(sub.bound(), completed);
            }
        }

        IntArrayList explored = selection.explored();
        for (int i = 0; i < explored.size(); i++) {
            int w = explored.getInt(i);
            if (context.dist(w) < bound && completedSet.add(w)) {
                completed.add(w);
            }
        }
        return new BoundedResult(bound, completed);
    }
}
