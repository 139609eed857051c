/**
 * Node handles and the node collection.
 * <ul>
 *   <li>{@link com.treeds.node.Node} – shared mutable handle: id, optional value, parent id, ordered child ids</li>
 *   <li>{@link com.treeds.node.NodeOwnership} – per-node access policy (single-threaded checked borrows, or a read/write lock)</li>
 *   <li>{@link com.treeds.node.NodeCollection} – ordered nodes with lookup by index or id, bulk append/retain/clear</li>
 *   <li>{@link com.treeds.node.id} – identifier generators and {@link com.treeds.node.id.NodeFactory}</li>
 * </ul>
 */
package com.treeds.node;
