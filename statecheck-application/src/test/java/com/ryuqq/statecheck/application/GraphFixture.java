package com.ryuqq.statecheck.application;

import com.ryuqq.statecheck.core.graph.Edge;
import com.ryuqq.statecheck.core.graph.ExplorationGraph;
import com.ryuqq.statecheck.core.graph.ReachableGraph;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.model.Transition;
import com.ryuqq.statecheck.core.spec.Action;
import com.ryuqq.statecheck.core.spec.Model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Hand-written state graphs for liveness and trace tests.
 *
 * <p>States are {@code n = id}, state 0 is the only initial state, actions are named
 * {@code A0, A1, ...} and label their edges with their own name. Discovery transitions
 * follow BFS from state 0 in edge declaration order.</p>
 */
public final class GraphFixture {

    private final int stateCount;
    private final Model model;
    private final ExplorationGraph graph;

    private GraphFixture(int stateCount, int actionCount, int[][] edges) {
        this.stateCount = stateCount;
        Model.Builder builder = Model.builder().initialState(State.of("n", 0));
        for (int a = 0; a < actionCount; a++) {
            builder.action(Action.stutter("A" + a));
        }
        this.model = builder.build();
        this.graph = new ExplorationGraph(actionCount);

        List<List<Edge>> out = new ArrayList<>();
        for (int i = 0; i < stateCount; i++) {
            out.add(new ArrayList<>());
        }
        for (int[] e : edges) {
            out.get(e[0]).add(new Edge(e[0], e[1], e[2], "A" + e[2]));
        }

        graph.recordInitial(0);
        boolean[] seen = new boolean[stateCount];
        seen[0] = true;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        while (!queue.isEmpty()) {
            int u = queue.poll();
            BitSet enabled = new BitSet();
            for (Edge edge : out.get(u)) {
                enabled.set(edge.actionIndex());
                if (!seen[edge.targetId()]) {
                    seen[edge.targetId()] = true;
                    graph.recordDiscovery(new Transition(u, edge.label(), edge.label(), edge.targetId()));
                    queue.add(edge.targetId());
                }
            }
            graph.recordExpansion(u, out.get(u), enabled);
        }
    }

    /**
     * @param edges triples {source, target, actionIndex}
     */
    public static GraphFixture of(int stateCount, int actionCount, int[]... edges) {
        return new GraphFixture(stateCount, actionCount, edges);
    }

    public static State state(int id) {
        return State.of("n", id);
    }

    public static int id(State state) {
        return (int) state.getLong("n");
    }

    public Model model() {
        return model;
    }

    public ExplorationGraph graph() {
        return graph;
    }

    public ReachableGraph reachable() {
        return graph.freeze(stateCount);
    }
}
