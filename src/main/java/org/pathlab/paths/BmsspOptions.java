package org.pathlab.paths;

import lombok.Builder;
import lombok.Value;
import org.pathlab.paths.core.BmsspSearchBudget;
import org.pathlab.paths.weight.WeightSpec;

/**
 * Optional knobs of one BMSSP call.
 *
 * <p>Unset fields fall back to their defaults when {@link BmsspPaths} normalizes the request.</p>
 *
 * @param <N> node label type.
 */
@Value
@Builder
public class BmsspOptions<N> {
    /** Edge weight source; defaults to the {@code "weight"} attribute. */
    WeightSpec<N> weight;
    /** Decimal places of reported distances; defaults to 0. */
    Integer precision;
    /** Node to stop at once its distance is final; null runs the full search. */
    N target;
    /** Frontier work cap; defaults to {@link BmsspSearchBudget#defaults()}. */
    BmsspSearchBudget budget;

    public static <N> BmsspOptions<N> defaults() {
        return BmsspOptions.<N>builder().build();
    }
}
