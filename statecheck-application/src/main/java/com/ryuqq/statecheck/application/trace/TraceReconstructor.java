package com.ryuqq.statecheck.application.trace;

import com.ryuqq.statecheck.application.liveness.FairComponent;
import com.ryuqq.statecheck.application.liveness.LivenessViolation;
import com.ryuqq.statecheck.core.graph.Edge;
import com.ryuqq.statecheck.core.graph.ExplorationGraph;
import com.ryuqq.statecheck.core.graph.PathFinder;
import com.ryuqq.statecheck.core.graph.ReachableGraph;
import com.ryuqq.statecheck.core.model.CounterexampleTrace;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.model.TraceStep;
import com.ryuqq.statecheck.core.model.Transition;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Builds counterexample traces from recorded transitions.
 *
 * <p><strong>Prefix:</strong> discovery transitions are followed backward from the
 * target state to the initial state that reached it. With single-threaded BFS this is
 * a shortest path.</p>
 *
 * <p><strong>Lasso cycle:</strong> starting at the entry state, the cycle walks to each
 * required edge and takes it, then to each required state, and finally back to the
 * entry. Every leg is a lowest-id-preferring shortest path inside the component. If
 * there is nothing to visit, the lowest internal edge out of the entry starts the
 * cycle.</p>
 *
 * <p>Traces never contain a step that was not recorded during exploration.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class TraceReconstructor {

    private final ExplorationGraph graph;
    private final IntFunction<State> states;

    public TraceReconstructor(ExplorationGraph graph, IntFunction<State> states) {
        if (graph == null || states == null) {
            throw new IllegalArgumentException("graph and states cannot be null");
        }
        this.graph = graph;
        this.states = states;
    }

    /**
     * Trace from an initial state to the given state.
     *
     * @param stateId recorded state
     * @return path trace ending at the state
     */
    public CounterexampleTrace safetyTrace(int stateId) {
        return CounterexampleTrace.path(pathTo(stateId));
    }

    /**
     * Lasso trace of a liveness violation.
     *
     * @param violation violation found on {@code reachable}
     * @param reachable frozen graph the violation refers to
     * @return lasso whose cycle returns to the entry state
     */
    public CounterexampleTrace lassoTrace(LivenessViolation violation, ReachableGraph reachable) {
        if (violation == null || reachable == null) {
            throw new IllegalArgumentException("violation and reachable cannot be null");
        }
        List<TraceStep> prefix = pathTo(violation.anchorId());
        for (Edge edge : violation.stem()) {
            prefix.add(step(edge));
        }

        List<TraceStep> cycle = new ArrayList<>();
        for (Edge edge : cycleEdges(violation.entryId(), violation.component(), reachable)) {
            cycle.add(step(edge));
        }
        return CounterexampleTrace.lasso(prefix, cycle);
    }

    private List<Edge> cycleEdges(int entry, FairComponent component, ReachableGraph reachable) {
        BitSet inside = component.states();
        List<Edge> edges = new ArrayList<>();
        int current = entry;

        for (Edge required : component.requiredEdges()) {
            edges.addAll(leg(reachable, current, required.sourceId(), inside));
            edges.add(required);
            current = required.targetId();
        }
        for (int required : component.requiredStates()) {
            edges.addAll(leg(reachable, current, required, inside));
            current = required;
        }
        if (edges.isEmpty()) {
            Edge first = lowestInternalEdge(reachable, entry, inside);
            edges.add(first);
            current = first.targetId();
        }
        edges.addAll(leg(reachable, current, entry, inside));
        return edges;
    }

    private static List<Edge> leg(ReachableGraph reachable, int from, int to, BitSet inside) {
        BitSet target = new BitSet();
        target.set(to);
        Optional<List<Edge>> path = PathFinder.shortestPath(reachable, from, target, inside);
        return path.orElseThrow(() -> new IllegalStateException(
            "No path from " + from + " to " + to + " inside a strongly connected component"));
    }

    private static Edge lowestInternalEdge(ReachableGraph reachable, int entry, BitSet inside) {
        for (int k = 0; k < reachable.outDegree(entry); k++) {
            if (inside.get(reachable.target(entry, k))) {
                return reachable.edge(entry, k);
            }
        }
        throw new IllegalStateException("State " + entry + " has no edge inside its component");
    }

    private List<TraceStep> pathTo(int stateId) {
        List<TraceStep> reversed = new ArrayList<>();
        int current = stateId;
        Optional<Transition> discovery = graph.discoveryOf(current);
        while (discovery.isPresent()) {
            Transition transition = discovery.get();
            reversed.add(new TraceStep(states.apply(current), transition.label()));
            current = transition.sourceId();
            discovery = graph.discoveryOf(current);
        }
        if (!graph.isInitial(current)) {
            throw new IllegalStateException("State " + current + " has neither a parent nor is initial");
        }
        reversed.add(TraceStep.initial(states.apply(current)));
        Collections.reverse(reversed);
        return reversed;
    }

    private TraceStep step(Edge edge) {
        return new TraceStep(states.apply(edge.targetId()), edge.label());
    }
}
