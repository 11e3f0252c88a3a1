package com.ryuqq.statecheck.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic shortest-path search over a {@link ReachableGraph}.
 *
 * <p>Breadth-first, walking adjacency lists in ascending target order: among shortest
 * paths, the one preferring the lowest state id at each step is returned. Searches can
 * be confined to a sub-graph.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class PathFinder {

    private PathFinder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Finds a shortest path from a state to any target, staying inside {@code allowed}.
     *
     * @param graph reachable graph
     * @param from start state (must be allowed)
     * @param targets acceptable end states
     * @param allowed states the path may visit
     * @return the edges of the path (empty if {@code from} is itself a target), or empty Optional if unreachable
     */
    public static Optional<List<Edge>> shortestPath(ReachableGraph graph, int from, BitSet targets, BitSet allowed) {
        if (!allowed.get(from)) {
            throw new IllegalArgumentException("Start state " + from + " is outside the allowed sub-graph");
        }
        if (targets.get(from)) {
            return Optional.of(List.of());
        }
        int n = graph.stateCount();
        int[] parent = new int[n];
        int[] parentEdge = new int[n];
        Arrays.fill(parent, -1);
        BitSet visited = new BitSet(n);
        visited.set(from);
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(from);

        while (!queue.isEmpty()) {
            int u = queue.poll();
            for (int k = 0; k < graph.outDegree(u); k++) {
                int w = graph.target(u, k);
                if (visited.get(w) || !allowed.get(w)) {
                    continue;
                }
                visited.set(w);
                parent[w] = u;
                parentEdge[w] = k;
                if (targets.get(w)) {
                    return Optional.of(unwind(graph, from, w, parent, parentEdge));
                }
                queue.add(w);
            }
        }
        return Optional.empty();
    }

    /**
     * States of {@code allowed} from which some target is reachable inside {@code allowed}.
     *
     * @param graph reachable graph
     * @param targets goal states
     * @param allowed states paths may visit
     * @return backward-reachable set, including the allowed targets themselves
     */
    public static BitSet canReach(ReachableGraph graph, BitSet targets, BitSet allowed) {
        BitSet result = new BitSet(graph.stateCount());
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
            if (allowed.get(t)) {
                result.set(t);
                queue.add(t);
            }
        }
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int i = 0; i < graph.predecessorCount(v); i++) {
                int u = graph.predecessor(v, i);
                if (allowed.get(u) && !result.get(u)) {
                    result.set(u);
                    queue.add(u);
                }
            }
        }
        return result;
    }

    private static List<Edge> unwind(ReachableGraph graph, int from, int to, int[] parent, int[] parentEdge) {
        List<Edge> path = new ArrayList<>();
        int v = to;
        while (v != from) {
            int u = parent[v];
            path.add(graph.edge(u, parentEdge[v]));
            v = u;
        }
        Collections.reverse(path);
        return path;
    }
}
