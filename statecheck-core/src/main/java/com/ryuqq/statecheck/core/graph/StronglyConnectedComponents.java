package com.ryuqq.statecheck.core.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Tarjan's strongly connected components over a sub-graph of a {@link ReachableGraph}.
 *
 * <p>Only states in the {@code allowed} set and edges between them are considered. The
 * traversal is iterative (explicit call stack), so deep graphs do not overflow the
 * thread stack.</p>
 *
 * <p><strong>Complexity:</strong> O(V + E) over the allowed sub-graph.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Decomposes the allowed sub-graph into SCCs.
     *
     * <p>Roots are visited in ascending id order and edges in adjacency order, so the
     * result is deterministic. Components are returned in the order Tarjan completes
     * them (reverse topological order).</p>
     *
     * @param graph reachable graph
     * @param allowed states to include
     * @return components, trivial ones included
     */
    public static List<BitSet> compute(ReachableGraph graph, BitSet allowed) {
        if (graph == null || allowed == null) {
            throw new IllegalArgumentException("graph and allowed cannot be null");
        }
        int n = graph.stateCount();
        int[] index = new int[n];
        int[] low = new int[n];
        int[] edgePos = new int[n];
        boolean[] onStack = new boolean[n];
        int[] stack = new int[n];
        int[] callStack = new int[n];
        Arrays.fill(index, -1);

        List<BitSet> components = new ArrayList<>();
        int counter = 0;
        int sp = 0;

        for (int root = allowed.nextSetBit(0); root >= 0 && root < n; root = allowed.nextSetBit(root + 1)) {
            if (index[root] != -1) {
                continue;
            }
            int depth = 0;
            callStack[depth++] = root;
            index[root] = low[root] = counter++;
            stack[sp++] = root;
            onStack[root] = true;

            while (depth > 0) {
                int u = callStack[depth - 1];
                if (edgePos[u] < graph.outDegree(u)) {
                    int w = graph.target(u, edgePos[u]++);
                    if (!allowed.get(w)) {
                        continue;
                    }
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        stack[sp++] = w;
                        onStack[w] = true;
                        callStack[depth++] = w;
                    } else if (onStack[w]) {
                        low[u] = Math.min(low[u], index[w]);
                    }
                    continue;
                }

                depth--;
                if (depth > 0) {
                    int parent = callStack[depth - 1];
                    low[parent] = Math.min(low[parent], low[u]);
                }
                if (low[u] == index[u]) {
                    BitSet component = new BitSet(n);
                    int w;
                    do {
                        w = stack[--sp];
                        onStack[w] = false;
                        component.set(w);
                    } while (w != u);
                    components.add(component);
                }
            }
        }
        return components;
    }

    /**
     * Whether a component can host an infinite behavior.
     *
     * @param graph reachable graph
     * @param component SCC
     * @return true if it has more than one state, or one state with a self-loop
     */
    public static boolean isNonTrivial(ReachableGraph graph, BitSet component) {
        int size = component.cardinality();
        if (size > 1) {
            return true;
        }
        return size == 1 && graph.hasSelfLoop(component.nextSetBit(0));
    }
}
