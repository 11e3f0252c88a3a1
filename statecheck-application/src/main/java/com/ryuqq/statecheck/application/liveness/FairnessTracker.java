package com.ryuqq.statecheck.application.liveness;

import com.ryuqq.statecheck.core.graph.Edge;
import com.ryuqq.statecheck.core.graph.ReachableGraph;
import com.ryuqq.statecheck.core.graph.StronglyConnectedComponents;
import com.ryuqq.statecheck.core.spec.FairnessKind;
import com.ryuqq.statecheck.core.spec.FairnessSpec;
import com.ryuqq.statecheck.core.spec.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Finds the fair strongly connected components of a sub-graph.
 *
 * <p><strong>Fairness rules</strong> (checked on each non-trivial SCC):</p>
 * <ul>
 *   <li><strong>Weak:</strong> if the action is enabled on every state of the SCC and no
 *       edge inside the SCC is labeled with it, the SCC is discarded. Any sub-cycle would
 *       keep the action continuously enabled and never taken.</li>
 *   <li><strong>Strong:</strong> if the action is enabled on some state of the SCC and
 *       never taken inside it, the states where it is enabled are removed and the
 *       remainder is decomposed again (Emerson-Lei refinement).</li>
 * </ul>
 *
 * <p><strong>Cycle obligations</strong> for a surviving SCC:</p>
 * <ul>
 *   <li>every fairness action taken inside: take its lowest-source-id internal edge</li>
 *   <li>a weakly fair action enabled on only part of the SCC and never taken: visit the lowest-id state where it is disabled</li>
 * </ul>
 *
 * <p>Enabledness is a property of the state in the full graph, independent of the
 * sub-graph being decomposed.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class FairnessTracker {

    private static final Logger log = LoggerFactory.getLogger(FairnessTracker.class);

    private final ReachableGraph graph;
    private final int[] fairActions;
    private final FairnessKind[] fairKinds;

    /**
     * @param graph reachable graph
     * @param model model declaring the actions
     * @param fairness fairness constraints of one property
     * @throws IllegalArgumentException if a fairness constraint names an undeclared action
     */
    public FairnessTracker(ReachableGraph graph, Model model, List<FairnessSpec> fairness) {
        if (graph == null || model == null || fairness == null) {
            throw new IllegalArgumentException("graph, model and fairness cannot be null");
        }
        this.graph = graph;
        this.fairActions = new int[fairness.size()];
        this.fairKinds = new FairnessKind[fairness.size()];
        for (int i = 0; i < fairness.size(); i++) {
            fairActions[i] = model.indexOfAction(fairness.get(i).actionName());
            fairKinds[i] = fairness.get(i).kind();
        }
    }

    /**
     * Decomposes the allowed sub-graph and keeps the components that admit a fair cycle.
     *
     * @param allowed states cycles may use
     * @return fair components, ordered by lowest member id
     */
    public List<FairComponent> fairComponents(BitSet allowed) {
        if (allowed == null) {
            throw new IllegalArgumentException("allowed cannot be null");
        }
        List<FairComponent> fair = new ArrayList<>();
        Deque<BitSet> pending = new ArrayDeque<>(StronglyConnectedComponents.compute(graph, allowed));

        while (!pending.isEmpty()) {
            BitSet component = pending.poll();
            if (!StronglyConnectedComponents.isNonTrivial(graph, component)) {
                continue;
            }
            List<Edge> requiredEdges = new ArrayList<>();
            List<Integer> requiredStates = new ArrayList<>();
            boolean rejected = false;

            for (int i = 0; i < fairActions.length && !rejected; i++) {
                int action = fairActions[i];
                Edge taken = lowestInternalEdge(component, action);
                if (taken != null) {
                    requiredEdges.add(taken);
                    continue;
                }
                BitSet enabledStates = enabledStates(component, action);
                if (enabledStates.isEmpty()) {
                    continue;
                }
                if (fairKinds[i] == FairnessKind.WEAK) {
                    BitSet disabled = (BitSet) component.clone();
                    disabled.andNot(enabledStates);
                    if (disabled.isEmpty()) {
                        log.debug("SCC {} rejected: WF action {} always enabled, never taken", component, action);
                        rejected = true;
                    } else {
                        requiredStates.add(disabled.nextSetBit(0));
                    }
                } else {
                    BitSet remainder = (BitSet) component.clone();
                    remainder.andNot(enabledStates);
                    log.debug("SCC {} refined: SF action {} enabled on {}, never taken", component, action,
                        enabledStates);
                    pending.addAll(StronglyConnectedComponents.compute(graph, remainder));
                    rejected = true;
                }
            }
            if (!rejected) {
                fair.add(new FairComponent(component, requiredEdges, requiredStates));
            }
        }
        fair.sort(Comparator.comparingInt(c -> c.states().nextSetBit(0)));
        return fair;
    }

    private Edge lowestInternalEdge(BitSet component, int action) {
        for (int s = component.nextSetBit(0); s >= 0; s = component.nextSetBit(s + 1)) {
            for (int k = 0; k < graph.outDegree(s); k++) {
                if (graph.action(s, k) == action && component.get(graph.target(s, k))) {
                    return graph.edge(s, k);
                }
            }
        }
        return null;
    }

    private BitSet enabledStates(BitSet component, int action) {
        BitSet enabled = new BitSet(graph.stateCount());
        for (int s = component.nextSetBit(0); s >= 0; s = component.nextSetBit(s + 1)) {
            if (graph.isEnabled(s, action)) {
                enabled.set(s);
            }
        }
        return enabled;
    }
}
