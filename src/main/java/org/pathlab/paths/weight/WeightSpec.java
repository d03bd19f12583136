package org.pathlab.paths.weight;

import java.util.Objects;

/**
 * How edge weights are obtained: from a named edge attribute or from a callback.
 *
 * @param <N> node label type.
 */
public interface WeightSpec<N> {

    /**
     * Returns the raw per-edge weight lookup this spec stands for, before validation.
     */
    EdgeWeightFunction<N> edgeWeights();

    /**
     * Weight read from the edge attribute {@code key}; absent attributes weigh 1.
     */
    record ByAttribute<N>(String key) implements WeightSpec<N> {
        public ByAttribute {
            Objects.requireNonNull(key, "key");
            if (key.isBlank()) {
                throw new IllegalArgumentException("weight attribute key must be non-blank");
            }
        }

        @Override
        public EdgeWeightFunction<N> edgeWeights() {
            return (u, v, attributes) -> WeightResolver.readAttribute(attributes, key, u, v);
        }
    }

    /**
     * Weight computed by a callback; a {@code null} result hides the edge.
     */
    record ByFunction<N>(EdgeWeightFunction<N> function) implements WeightSpec<N> {
        public ByFunction {
            Objects.requireNonNull(function, "function");
        }

        @Override
        public EdgeWeightFunction<N> edgeWeights() {
            return function;
        }
    }

    static <N> WeightSpec<N> attribute(String key) {
        return new ByAttribute<>(key);
    }

    static <N> WeightSpec<N> function(EdgeWeightFunction<N> function) {
        return new ByFunction<>(function);
    }

    /**
     * Returns the conventional {@code "weight"} attribute spec.
     */
    static <N> WeightSpec<N> defaultWeight() {
        return new ByAttribute<>(WeightResolver.DEFAULT_ATTRIBUTE);
    }
}
