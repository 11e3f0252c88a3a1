package com.ryuqq.statecheck.application.liveness;

import com.ryuqq.statecheck.core.exception.EvaluatorFaultException;
import com.ryuqq.statecheck.core.graph.Edge;
import com.ryuqq.statecheck.core.graph.PathFinder;
import com.ryuqq.statecheck.core.graph.ReachableGraph;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spec.TemporalProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Checks temporal properties on a fully explored state graph.
 *
 * <p>Each property is reduced to the search for a reachable fair cycle:</p>
 * <pre>
 * property              cycle states   obligation starts at               cycle must contain
 * ALWAYS_EVENTUALLY P   not P          any reachable state                -
 * EVENTUALLY P          not P          initial not-P state, via not P     -
 * EVENTUALLY_ALWAYS P   all            any reachable state                a not-P state
 * P LEADS_TO Q          not Q          reachable P and not Q, via not Q   -
 * </pre>
 *
 * <p><strong>Determinism:</strong> candidate anchors are ranked by (BFS depth, state id)
 * and, for EVENTUALLY, by initial-state declaration order; stems are lowest-id-preferring
 * shortest paths. The same graph always yields the same violation.</p>
 *
 * <p>Deadlocked and constraint-pruned states have no outgoing edges, so they never lie
 * on a cycle: finite behaviors do not refute liveness.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class LivenessChecker {

    private static final Logger log = LoggerFactory.getLogger(LivenessChecker.class);

    private final ReachableGraph graph;
    private final Model model;
    private final IntFunction<State> states;

    /**
     * @param graph frozen reachable graph of a complete exploration
     * @param model explored model
     * @param states state lookup by id
     */
    public LivenessChecker(ReachableGraph graph, Model model, IntFunction<State> states) {
        if (graph == null || model == null || states == null) {
            throw new IllegalArgumentException("graph, model and states cannot be null");
        }
        this.graph = graph;
        this.model = model;
        this.states = states;
    }

    /**
     * Checks one property.
     *
     * @param property temporal property with its fairness constraints
     * @return the violation, or empty if the property holds
     * @throws EvaluatorFaultException if a property predicate throws
     */
    public Optional<LivenessViolation> check(TemporalProperty property) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        FairnessTracker fairness = new FairnessTracker(graph, model, property.fairness());
        BitSet p = evaluate(property, property.p());
        BitSet notP = complement(p);

        Optional<LivenessViolation> violation;
        switch (property.kind()) {
            case ALWAYS_EVENTUALLY:
                violation = shallowestCycle(property, fairness.fairComponents(notP));
                break;
            case EVENTUALLY_ALWAYS:
                violation = shallowestCycle(property, visitingAny(fairness.fairComponents(graph.allStates()), notP));
                break;
            case EVENTUALLY:
                violation = fromInitialStates(property, notP, fairness.fairComponents(notP));
                break;
            case LEADS_TO:
                BitSet notQ = complement(evaluate(property, property.q()));
                BitSet pending = (BitSet) p.clone();
                pending.and(notQ);
                violation = fromPendingStates(property, pending, notQ, fairness.fairComponents(notQ));
                break;
            default:
                throw new IllegalStateException("Unsupported property kind: " + property.kind());
        }
        log.debug("Property {} ({}): {}", property.name(), property.kind(),
            violation.isPresent() ? "violated" : "holds");
        return violation;
    }

    private Optional<LivenessViolation> shallowestCycle(TemporalProperty property, List<FairComponent> components) {
        int best = -1;
        FairComponent bestComponent = null;
        for (FairComponent component : components) {
            BitSet members = component.states();
            for (int s = members.nextSetBit(0); s >= 0; s = members.nextSetBit(s + 1)) {
                if (best < 0 || graph.depth(s) < graph.depth(best)
                    || (graph.depth(s) == graph.depth(best) && s < best)) {
                    best = s;
                    bestComponent = component;
                }
            }
        }
        if (bestComponent == null) {
            return Optional.empty();
        }
        return Optional.of(new LivenessViolation(property.name(), best, List.of(), best, bestComponent));
    }

    private Optional<LivenessViolation> fromInitialStates(TemporalProperty property, BitSet allowed,
                                                          List<FairComponent> components) {
        if (components.isEmpty()) {
            return Optional.empty();
        }
        BitSet cycleStates = union(components);
        for (int initial : graph.initialIds()) {
            if (!allowed.get(initial)) {
                continue;
            }
            Optional<List<Edge>> stem = PathFinder.shortestPath(graph, initial, cycleStates, allowed);
            if (stem.isPresent()) {
                return Optional.of(violation(property, initial, stem.get(), components));
            }
        }
        return Optional.empty();
    }

    private Optional<LivenessViolation> fromPendingStates(TemporalProperty property, BitSet pending, BitSet allowed,
                                                          List<FairComponent> components) {
        if (components.isEmpty() || pending.isEmpty()) {
            return Optional.empty();
        }
        BitSet cycleStates = union(components);
        BitSet candidates = PathFinder.canReach(graph, cycleStates, allowed);
        candidates.and(pending);

        int anchor = -1;
        for (int s = candidates.nextSetBit(0); s >= 0; s = candidates.nextSetBit(s + 1)) {
            if (anchor < 0 || graph.depth(s) < graph.depth(anchor)
                || (graph.depth(s) == graph.depth(anchor) && s < anchor)) {
                anchor = s;
            }
        }
        if (anchor < 0) {
            return Optional.empty();
        }
        List<Edge> stem = PathFinder.shortestPath(graph, anchor, cycleStates, allowed)
            .orElseThrow(() -> new IllegalStateException("backward-reachable state has no forward path"));
        return Optional.of(violation(property, anchor, stem, components));
    }

    private LivenessViolation violation(TemporalProperty property, int anchor, List<Edge> stem,
                                        List<FairComponent> components) {
        int entry = stem.isEmpty() ? anchor : stem.get(stem.size() - 1).targetId();
        for (FairComponent component : components) {
            if (component.contains(entry)) {
                return new LivenessViolation(property.name(), anchor, stem, entry, component);
            }
        }
        throw new IllegalStateException("Entry state " + entry + " belongs to no fair component");
    }

    private List<FairComponent> visitingAny(List<FairComponent> components, BitSet required) {
        List<FairComponent> result = new ArrayList<>();
        for (FairComponent component : components) {
            BitSet hits = component.states();
            hits.and(required);
            if (!hits.isEmpty()) {
                result.add(component.requiringState(hits.nextSetBit(0)));
            }
        }
        return result;
    }

    private BitSet evaluate(TemporalProperty property, Predicate<State> predicate) {
        BitSet result = new BitSet(graph.stateCount());
        for (int id = 0; id < graph.stateCount(); id++) {
            State state = states.apply(id);
            boolean holds;
            try {
                holds = predicate.test(state);
            } catch (RuntimeException | Error e) {
                if (!EvaluatorFaultException.isFault(e)) {
                    throw e;
                }
                throw new EvaluatorFaultException(property.name(),
                    "Property " + property.name() + " threw on " + state + ": " + e.getMessage(), e);
            }
            if (holds) {
                result.set(id);
            }
        }
        return result;
    }

    private BitSet complement(BitSet set) {
        BitSet result = graph.allStates();
        result.andNot(set);
        return result;
    }

    private static BitSet union(List<FairComponent> components) {
        BitSet result = new BitSet();
        for (FairComponent component : components) {
            result.or(component.states());
        }
        return result;
    }
}
