/**
 * Error taxonomy shared by nodes, trees and the codec.
 * <ul>
 *   <li>{@link com.treeds.error.TreeException} – unchecked base of all recoverable failures</li>
 *   <li>{@link com.treeds.error.RootNodeAlreadyPresentException} – second root added</li>
 *   <li>{@link com.treeds.error.NodeNotFoundException} – id lookup failed</li>
 *   <li>{@link com.treeds.error.InvalidOperationException} – structurally illegal request</li>
 *   <li>{@link com.treeds.error.TreeFormatException} – text rendering failed</li>
 *   <li>{@link com.treeds.error.AccessConflictException} – node accessed during its own mutation</li>
 * </ul>
 * Broken internal invariants (e.g. a cycle built through node handles) surface as {@link java.lang.IllegalStateException}.
 */
package com.treeds.error;
