package com.ryuqq.statecheck.core.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable, arena-indexed reachable state graph.
 *
 * <p>States are dense integer ids indexing flat arrays; there are no object references
 * between nodes, so cyclic structures need no special lifetime handling and adjacency
 * scans stay cache friendly.</p>
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * targets[s][k]   target id of the k-th outgoing edge of s (ascending)
 * actions[s][k]   action index of that edge
 * labels[s][k]    action-instance label of that edge
 * preds[s]        distinct predecessor ids of s (ascending)
 * enabled[s]      action indexes that produced a successor on s
 * </pre>
 *
 * <p>Unexpanded states (constraint-pruned) have no outgoing edges and no enabled actions.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class ReachableGraph {

    private static final Comparator<Edge> EDGE_ORDER = Comparator
        .comparingInt(Edge::targetId)
        .thenComparingInt(Edge::actionIndex)
        .thenComparing(Edge::label);

    private final int[][] targets;
    private final int[][] actions;
    private final String[][] labels;
    private final int[][] predecessors;
    private final BitSet[] enabled;
    private final int[] depth;
    private final int[] initialIds;

    ReachableGraph(Edge[][] adjacency, BitSet[] enabled, int[] depth, int[] initialIds) {
        int stateCount = adjacency.length;
        this.targets = new int[stateCount][];
        this.actions = new int[stateCount][];
        this.labels = new String[stateCount][];
        this.enabled = enabled;
        this.depth = depth;
        this.initialIds = initialIds;

        int[] predCount = new int[stateCount];
        for (int source = 0; source < stateCount; source++) {
            Edge[] sorted = adjacency[source].clone();
            Arrays.sort(sorted, EDGE_ORDER);
            List<Edge> unique = new ArrayList<>(sorted.length);
            for (Edge edge : sorted) {
                if (edge.targetId() >= stateCount) {
                    throw new IllegalArgumentException("Edge " + edge + " leaves the graph of " + stateCount + " states");
                }
                if (unique.isEmpty() || EDGE_ORDER.compare(unique.get(unique.size() - 1), edge) != 0) {
                    unique.add(edge);
                }
            }
            int size = unique.size();
            targets[source] = new int[size];
            actions[source] = new int[size];
            labels[source] = new String[size];
            int previousTarget = -1;
            for (int k = 0; k < size; k++) {
                Edge edge = unique.get(k);
                targets[source][k] = edge.targetId();
                actions[source][k] = edge.actionIndex();
                labels[source][k] = edge.label();
                if (edge.targetId() != previousTarget) {
                    predCount[edge.targetId()]++;
                    previousTarget = edge.targetId();
                }
            }
        }

        this.predecessors = new int[stateCount][];
        for (int id = 0; id < stateCount; id++) {
            predecessors[id] = new int[predCount[id]];
        }
        int[] fill = new int[stateCount];
        for (int source = 0; source < stateCount; source++) {
            int previousTarget = -1;
            for (int target : targets[source]) {
                if (target != previousTarget) {
                    predecessors[target][fill[target]++] = source;
                    previousTarget = target;
                }
            }
        }
    }

    public int stateCount() {
        return targets.length;
    }

    public int outDegree(int stateId) {
        return targets[stateId].length;
    }

    public int target(int stateId, int edgeIndex) {
        return targets[stateId][edgeIndex];
    }

    public int action(int stateId, int edgeIndex) {
        return actions[stateId][edgeIndex];
    }

    public String label(int stateId, int edgeIndex) {
        return labels[stateId][edgeIndex];
    }

    public Edge edge(int stateId, int edgeIndex) {
        return new Edge(stateId, targets[stateId][edgeIndex], actions[stateId][edgeIndex], labels[stateId][edgeIndex]);
    }

    public int predecessorCount(int stateId) {
        return predecessors[stateId].length;
    }

    public int predecessor(int stateId, int index) {
        return predecessors[stateId][index];
    }

    public boolean isEnabled(int stateId, int actionIndex) {
        return enabled[stateId].get(actionIndex);
    }

    /**
     * Whether the state has an edge to itself (stutter or any action leaving it unchanged).
     */
    public boolean hasSelfLoop(int stateId) {
        return Arrays.binarySearch(targets[stateId], stateId) >= 0;
    }

    /**
     * Length of the discovery path from an initial state, {@code Integer.MAX_VALUE} if unknown.
     */
    public int depth(int stateId) {
        return depth[stateId];
    }

    /**
     * Initial state ids in declaration order.
     *
     * @return copy of the initial ids
     */
    public int[] initialIds() {
        return initialIds.clone();
    }

    /**
     * Set containing every state id.
     *
     * @return new BitSet with bits 0..stateCount-1 set
     */
    public BitSet allStates() {
        BitSet all = new BitSet(stateCount());
        all.set(0, stateCount());
        return all;
    }
}
