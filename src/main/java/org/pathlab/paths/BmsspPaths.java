package org.pathlab.paths;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pathlab.graph.Graph;
import org.pathlab.paths.core.AdjacencySnapshot;
import org.pathlab.paths.core.BmsspParameters;
import org.pathlab.paths.core.BmsspSearchBudget;
import org.pathlab.paths.core.BmsspSolver;
import org.pathlab.paths.core.NoPathException;
import org.pathlab.paths.core.ResultAssembler;
import org.pathlab.paths.core.SearchOutcome;
import org.pathlab.paths.core.ShortestPathResult;
import org.pathlab.paths.weight.WeightResolver;
import org.pathlab.paths.weight.WeightSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Single- and multi-source shortest paths on directed graphs with non-negative weights, computed
 * by bounded multi-source shortest path (BMSSP) recursion.
 *
 * <p>Distances are reported as plain weight sums rounded to {@code precision} decimals. Among
 * equal-length paths the result is deterministic: edges earlier in the graph's edge order win.
 * Every call builds its own snapshot and search state, so concurrent calls on graphs that are
 * not being mutated are safe.</p>
 *
 * <p>Overloads stand in for optional arguments: weight defaults to the {@code "weight"} attribute
 * (missing attribute = 1), precision to 0, target to none.</p>
 */
public final class BmsspPaths {
    private static final Logger log = LoggerFactory.getLogger(BmsspPaths.class);

    private BmsspPaths() {
    }

    public static <N> ShortestPathResult<N> bmssp(Graph<N> graph, Collection<N> sources) {
        return bmssp(graph, sources, BmsspOptions.<N>defaults());
    }

    public static <N> ShortestPathResult<N> bmssp(Graph<N> graph, Collection<N> sources, N target) {
        return bmssp(graph, sources, BmsspOptions.<N>builder().target(target).build());
    }

    public static <N> ShortestPathResult<N> bmssp(
            Graph<N> graph,
            Collection<N> sources,
            N target,
            WeightSpec<N> weight,
            int precision
    ) {
        return bmssp(graph, sources, BmsspOptions.<N>builder()
                .target(target)
                .weight(weight)
                .precision(precision)
                .build());
    }

    /**
     * Runs one BMSSP search.
     *
     * @param graph   directed graph; read once into a snapshot.
     * @param sources source nodes; duplicates are ignored.
     * @param options weight, precision, optional target and budget.
     * @return every reachable node with its distance and a path from the nearest source.
     *         With a target, only the target's entry is guaranteed final.
     * @throws org.pathlab.paths.core.UnsupportedGraphException for undirected graphs.
     * @throws org.pathlab.paths.core.NodeNotFoundException     when a source or the target is absent.
     * @throws org.pathlab.paths.weight.InvalidWeightException  on a negative or NaN weight.
     * @throws IllegalArgumentException                         on empty sources or negative precision.
     */
    public static <N> ShortestPathResult<N> bmssp(Graph<N> graph, Collection<N> sources, BmsspOptions<N> options) {
        Objects.requireNonNull(options, "options");
        ShortestPathRequests.requireDirected(graph);
        Set<N> sourceSet = ShortestPathRequests.requireSources(graph, sources);
        int precision = ShortestPathRequests.requirePrecision(options.getPrecision());
        N target = options.getTarget();
        if (target != null) {
            ShortestPathRequests.requireNode(graph, target);
        }
        WeightSpec<N> weight = options.getWeight() == null ? WeightSpec.defaultWeight() : options.getWeight();
        BmsspSearchBudget budget = options.getBudget() == null ? BmsspSearchBudget.defaults() : options.getBudget();

        BmsspParameters parameters = BmsspParameters.derive(graph.nodeCount(), graph.edgeCount(), precision);
        log.debug("bmssp: n={} m={} sources={} k={} t={} depth={}",
                graph.nodeCount(), graph.edgeCount(), sourceSet.size(),
                parameters.k(), parameters.t(), parameters.depth());

        AdjacencySnapshot<N> snapshot = AdjacencySnapshot.build(
                graph, WeightResolver.of(weight), parameters.edgeAdjustment());
        IntArrayList sourceIndices = ShortestPathRequests.toIndices(snapshot.nodeIndex(), sourceSet);
        int targetIndex = target == null ? BmsspSolver.NO_TARGET : snapshot.nodeIndex().toIndex(target);

        SearchOutcome outcome = BmsspSolver.run(snapshot, parameters, sourceIndices, targetIndex, budget);
        return ResultAssembler.assemble(snapshot, outcome, precision);
    }

    public static <N> List<N> singleSourcePath(Graph<N> graph, N source, N target) {
        return singleSourcePath(graph, source, target, WeightSpec.defaultWeight(), 0);
    }

    /**
     * Returns the node sequence of a shortest path from {@code source} to {@code target}.
     *
     * @throws NoPathException when {@code target} is unreachable.
     */
    public static <N> List<N> singleSourcePath(
            Graph<N> graph,
            N source,
            N target,
            WeightSpec<N> weight,
            int precision
    ) {
        ShortestPathResult<N> result = searchTowards(graph, source, target, weight, precision);
        List<N> path = result.getPaths().get(target);
        if (path == null) {
            throw new NoPathException(target, source);
        }
        return path;
    }

    public static <N> double singleSourcePathLength(Graph<N> graph, N source, N target) {
        return singleSourcePathLength(graph, source, target, WeightSpec.defaultWeight(), 0);
    }

    /**
     * Returns the shortest distance from {@code source} to {@code target}; 0 when they coincide.
     *
     * @throws NoPathException when {@code target} is unreachable.
     */
    public static <N> double singleSourcePathLength(
            Graph<N> graph,
            N source,
            N target,
            WeightSpec<N> weight,
            int precision
    ) {
        ShortestPathRequests.requireDirected(graph);
        ShortestPathRequests.requireNode(graph, source);
        ShortestPathRequests.requireNode(graph, target);
        ShortestPathRequests.requirePrecision(precision);
        if (source.equals(target)) {
            return 0.0d;
        }
        ShortestPathResult<N> result = searchTowards(graph, source, target, weight, precision);
        Double distance = result.getDistances().get(target);
        if (distance == null) {
            throw new NoPathException(target, source);
        }
        return distance;
    }

    public static <N> Map<N, List<N>> multiSourcePaths(Graph<N> graph, Collection<N> sources) {
        return multiSourcePaths(graph, sources, WeightSpec.defaultWeight(), 0);
    }

    /**
     * Returns, for every node reachable from any source, a path starting at its nearest source.
     */
    public static <N> Map<N, List<N>> multiSourcePaths(
            Graph<N> graph,
            Collection<N> sources,
            WeightSpec<N> weight,
            int precision
    ) {
        return bmssp(graph, sources, null, weight, precision).getPaths();
    }

    public static <N> Map<N, Double> multiSourcePathLengths(Graph<N> graph, Collection<N> sources) {
        return multiSourcePathLengths(graph, sources, WeightSpec.defaultWeight(), 0);
    }

    /**
     * Returns, for every node reachable from any source, its distance to the nearest source.
     */
    public static <N> Map<N, Double> multiSourcePathLengths(
            Graph<N> graph,
            Collection<N> sources,
            WeightSpec<N> weight,
            int precision
    ) {
        return bmssp(graph, sources, null, weight, precision).getDistances();
    }

    private static <N> ShortestPathResult<N> searchTowards(
            Graph<N> graph,
            N source,
            N target,
            WeightSpec<N> weight,
            int precision
    ) {
        ShortestPathRequests.requireDirected(graph);
        ShortestPathRequests.requireNode(graph, source);
        ShortestPathRequests.requireNode(graph, target);
        return bmssp(graph, List.of(source), target, weight, precision);
    }
}
