package org.pathlab.paths.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Outcome of one bounded sub-problem.
 *
 * @param bound     completion bound, never above the bound the call received.
 * @param completed nodes whose final distance is proven below {@code bound}.
 */
record BoundedResult(double bound, IntArrayList completed) {
}
