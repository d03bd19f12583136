package org.pathlab.paths.core;

import lombok.Builder;
import lombok.Value;

/**
 * Work counters of one top-level BMSSP call.
 */
@Value
@Builder
public class BmsspExecutionStats {
    /** Derived pivot/base-case parameter. */
    int k;
    /** Derived branching parameter. */
    int t;
    /** Derived top recursion level. */
    int depth;
    /** Recursive driver invocations, base-case levels included. */
    long recursiveCalls;
    /** Base-case (level 0) invocations. */
    long baseCaseCalls;
    /** Pivot-finder invocations. */
    long pivotSearches;
    /** Pivot searches that stopped because the explored set grew past {@code k * |S|}. */
    long widePivotSearches;
    /** Pivots handed to frontiers. */
    long pivotsSelected;
    /** Frontier group pulls. */
    long frontierPulls;
    /** Successful edge relaxations. */
    long relaxations;
    /** Whether the search stopped as soon as the target was completed. */
    boolean stoppedAtTarget;
}
