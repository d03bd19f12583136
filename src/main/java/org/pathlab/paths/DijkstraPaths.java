package org.pathlab.paths;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pathlab.graph.Graph;
import org.pathlab.paths.core.AdjacencySnapshot;
import org.pathlab.paths.core.NoPathException;
import org.pathlab.paths.core.ResultAssembler;
import org.pathlab.paths.core.SearchOutcome;
import org.pathlab.paths.core.ShortestPathResult;
import org.pathlab.paths.search.BoundedFrontier;
import org.pathlab.paths.weight.WeightResolver;
import org.pathlab.paths.weight.WeightSpec;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Classic multi-source Dijkstra over the same weight resolution and snapshot as {@link BmsspPaths}.
 *
 * <p>No tie-break perturbation is applied: among equal-length paths the first one settled wins.
 * Accepts directed graphs only, like {@link BmsspPaths}.</p>
 */
public final class DijkstraPaths {

    private DijkstraPaths() {
    }

    public static <N> ShortestPathResult<N> dijkstra(Graph<N> graph, Collection<N> sources) {
        return dijkstra(graph, sources, WeightSpec.defaultWeight(), 0);
    }

    /**
     * Computes distances and paths from the nearest of {@code sources} to every reachable node.
     */
    public static <N> ShortestPathResult<N> dijkstra(
            Graph<N> graph,
            Collection<N> sources,
            WeightSpec<N> weight,
            int precision
    ) {
        ShortestPathRequests.requireDirected(graph);
        Set<N> sourceSet = ShortestPathRequests.requireSources(graph, sources);
        int validPrecision = ShortestPathRequests.requirePrecision(precision);
        AdjacencySnapshot<N> snapshot = AdjacencySnapshot.build(graph, WeightResolver.of(weight), 0.0d);
        IntArrayList sourceIndices = ShortestPathRequests.toIndices(snapshot.nodeIndex(), sourceSet);
        return ResultAssembler.assemble(snapshot, search(snapshot, sourceIndices), validPrecision);
    }

    public static <N> double pathLength(Graph<N> graph, N source, N target) {
        return pathLength(graph, source, target, WeightSpec.defaultWeight());
    }

    /**
     * Returns the unrounded shortest distance from {@code source} to {@code target}.
     *
     * @throws NoPathException when {@code target} is unreachable.
     */
    public static <N> double pathLength(Graph<N> graph, N source, N target, WeightSpec<N> weight) {
        ShortestPathRequests.requireDirected(graph);
        ShortestPathRequests.requireNode(graph, source);
        ShortestPathRequests.requireNode(graph, target);
        AdjacencySnapshot<N> snapshot = AdjacencySnapshot.build(graph, WeightResolver.of(weight), 0.0d);
        IntArrayList sourceIndices = ShortestPathRequests.toIndices(snapshot.nodeIndex(), Set.of(source));
        double distance = search(snapshot, sourceIndices).distances()[snapshot.nodeIndex().toIndex(target)];
        if (distance == Double.POSITIVE_INFINITY) {
            throw new NoPathException(target, source);
        }
        return distance;
    }

    public static <N> List<N> path(Graph<N> graph, N source, N target) {
        ShortestPathRequests.requireDirected(graph);
        ShortestPathRequests.requireNode(graph, source);
        ShortestPathRequests.requireNode(graph, target);
        List<N> path = dijkstra(graph, List.of(source)).getPaths().get(target);
        if (path == null) {
            throw new NoPathException(target, source);
        }
        return path;
    }

    private static SearchOutcome search(AdjacencySnapshot<?> graph, IntArrayList sources) {
        int nodeCount = graph.nodeCount();
        double[] dist = new double[nodeCount];
        int[] pred = new int[nodeCount];
        boolean[] settled = new boolean[nodeCount];
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        Arrays.fill(pred, -1);

        BoundedFrontier frontier = new BoundedFrontier(Math.max(16, sources.size()));
        for (int i = 0; i < sources.size(); i++) {
            int source = sources.getInt(i);
            dist[source] = 0.0d;
            frontier.insert(source, 0.0d);
        }

        while (!frontier.isEmpty()) {
            int u = frontier.extractMin();
            settled[u] = true;
            int end = graph.firstEdge(u + 1);
            for (int slot = graph.firstEdge(u); slot < end; slot++) {
                int v = graph.edgeTarget(slot);
                if (settled[v]) {
                    continue;
                }
                double candidate = dist[u] + graph.edgeWeight(slot);
                if (candidate < dist[v]) {
                    dist[v] = candidate;
                    pred[v] = u;
                    frontier.insert(v, candidate);
                }
            }
        }
        return new SearchOutcome(dist, dist, pred, null);
    }
}
