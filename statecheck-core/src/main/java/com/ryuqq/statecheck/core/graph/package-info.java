/**
 * Reachable state graph and the graph algorithms liveness checking relies on.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statecheck.core.graph.ExplorationGraph} - Thread-safe recorder used during exploration</li>
 *   <li>{@link com.ryuqq.statecheck.core.graph.ReachableGraph} - Frozen, arena-indexed adjacency lists</li>
 *   <li>{@link com.ryuqq.statecheck.core.graph.StronglyConnectedComponents} - Iterative Tarjan decomposition</li>
 *   <li>{@link com.ryuqq.statecheck.core.graph.PathFinder} - Lowest-id-preferring shortest paths and cycles</li>
 * </ul>
 *
 * <p>States are integer ids handed out by the {@code StateStore}; the graph never holds
 * {@code State} objects.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.core.graph;
