/**
 * The tree container and its algorithms.
 * <ul>
 *   <li>{@link com.treeds.tree.Tree} – structural queries, removal, subtree extraction and merge</li>
 *   <li>{@link com.treeds.tree.TraversalStrategy} / {@link com.treeds.tree.NodeRemovalStrategy} – policies</li>
 *   <li>{@code TreeTraversal} – stack-based pre/post/in-order walks</li>
 *   <li>{@code TreeRenderer} – box-drawing text outline</li>
 * </ul>
 */
package com.treeds.tree;
