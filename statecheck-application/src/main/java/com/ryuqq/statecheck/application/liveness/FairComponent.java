package com.ryuqq.statecheck.application.liveness;

import com.ryuqq.statecheck.core.graph.Edge;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Strongly connected component that can host a fair infinite behavior.
 *
 * <p>A cycle through the component satisfies every fairness constraint if it takes
 * each of {@code requiredEdges} and visits each of {@code requiredStates}.</p>
 *
 * @param states component members
 * @param requiredEdges one edge per fairness action taken inside the component (lowest source id)
 * @param requiredStates states the cycle must visit (e.g. where a weakly fair action is disabled)
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record FairComponent(BitSet states, List<Edge> requiredEdges, List<Integer> requiredStates) {

    public FairComponent {
        if (states == null || states.isEmpty()) {
            throw new IllegalArgumentException("states cannot be null or empty");
        }
        states = (BitSet) states.clone();
        requiredEdges = requiredEdges == null ? List.of() : List.copyOf(requiredEdges);
        requiredStates = requiredStates == null ? List.of() : List.copyOf(requiredStates);
    }

    @Override
    public BitSet states() {
        return (BitSet) states.clone();
    }

    public boolean contains(int stateId) {
        return states.get(stateId);
    }

    /**
     * Copy that additionally requires visiting a state.
     *
     * @param stateId member state to visit
     * @return new component
     */
    public FairComponent requiringState(int stateId) {
        if (!states.get(stateId)) {
            throw new IllegalArgumentException("State " + stateId + " is not in the component");
        }
        List<Integer> visits = new ArrayList<>(requiredStates);
        visits.add(stateId);
        return new FairComponent(states, requiredEdges, visits);
    }
}
