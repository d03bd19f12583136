package org.pathlab.paths.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Outcome of a bounded Bellman-Ford pivot search.
 *
 * @param pivots   sources that anchor a recursive sub-call; a subset of the sources.
 * @param explored sources plus every node reached below the bound.
 * @param wide     whether the search stopped because {@code explored} outgrew {@code k * |S|}.
 */
record PivotSelection(IntArrayList pivots, IntArrayList explored, boolean wide) {
}
