package org.pathlab.paths.weight;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link WeightSpec} into one validated weight per ordered node pair.
 *
 * <p>Parallel edges collapse to their minimum weight; hidden edges ({@code null}
 * callback results) are ignored, and a pair whose edges are all hidden resolves to
 * {@code null}. Attribute lookups default to {@value #DEFAULT_WEIGHT_VALUE} when the
 * attribute is absent. Every resolved value is checked once here so the search loops
 * never re-validate.</p>
 *
 * @param <N> node label type.
 */
public final class WeightResolver<N> {
    public static final String DEFAULT_ATTRIBUTE = "weight";
    public static final double DEFAULT_WEIGHT_VALUE = 1.0d;

    public static final String REASON_NEGATIVE = "WEIGHT_NEGATIVE";
    public static final String REASON_NOT_A_NUMBER = "WEIGHT_NOT_A_NUMBER";
    public static final String REASON_NOT_NUMERIC = "WEIGHT_NOT_NUMERIC";

    private final EdgeWeightFunction<N> edgeWeight;

    private WeightResolver(EdgeWeightFunction<N> edgeWeight) {
        this.edgeWeight = edgeWeight;
    }

    /**
     * Binds a weight specification.
     */
    public static <N> WeightResolver<N> of(WeightSpec<N> spec) {
        return new WeightResolver<>(Objects.requireNonNull(spec, "spec").edgeWeights());
    }

    /**
     * Resolves the weight of a single edge.
     *
     * @return validated weight, or {@code null} when the edge is hidden.
     * @throws InvalidWeightException when the weight is negative or NaN.
     */
    public Double edgeWeight(N source, N target, Map<String, Object> attributes) {
        Number raw = edgeWeight.weight(source, target, attributes);
        if (raw == null) {
            return null;
        }
        return validate(raw.doubleValue(), source, target);
    }

    /**
     * Resolves the weight of an ordered pair from all of its parallel edges.
     *
     * @param parallelEdges attribute maps of every edge {@code source -> target}.
     * @return minimum visible weight, or {@code null} when every edge is hidden.
     * @throws InvalidWeightException when any visible weight is negative or NaN.
     */
    public Double pairWeight(N source, N target, List<Map<String, Object>> parallelEdges) {
        Double best = null;
        for (Map<String, Object> attributes : parallelEdges) {
            Double weight = edgeWeight(source, target, attributes);
            if (weight != null && (best == null || weight < best)) {
                best = weight;
            }
        }
        return best;
    }

    /**
     * Reads {@code key} from one edge's attributes; absent means {@value #DEFAULT_WEIGHT_VALUE}.
     */
    static Number readAttribute(Map<String, Object> attributes, String key, Object u, Object v) {
        Object raw = attributes.get(key);
        if (raw == null) {
            return DEFAULT_WEIGHT_VALUE;
        }
        if (!(raw instanceof Number)) {
            throw new InvalidWeightException(
                    REASON_NOT_NUMERIC,
                    "edge " + u + " -> " + v + " has non-numeric '" + key + "': " + raw
            );
        }
        return (Number) raw;
    }

    private static double validate(double weight, Object u, Object v) {
        if (Double.isNaN(weight)) {
            throw new InvalidWeightException(REASON_NOT_A_NUMBER, "edge " + u + " -> " + v + " has NaN weight");
        }
        if (weight < 0.0d) {
            throw new InvalidWeightException(
                    REASON_NEGATIVE,
                    "edge " + u + " -> " + v + " has negative weight " + weight
            );
        }
        return weight;
    }
}
