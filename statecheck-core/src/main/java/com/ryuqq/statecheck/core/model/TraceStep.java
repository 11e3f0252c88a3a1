package com.ryuqq.statecheck.core.model;

/**
 * One step of a counterexample trace.
 *
 * @param state the state reached by this step
 * @param actionName label of the action that produced the state, null for an initial state
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record TraceStep(State state, String actionName) {

    public TraceStep {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * Creates the first step of a trace.
     *
     * @param state initial state
     * @return TraceStep without inbound action
     */
    public static TraceStep initial(State state) {
        return new TraceStep(state, null);
    }

    public boolean isInitial() {
        return actionName == null;
    }

    @Override
    public String toString() {
        return (actionName == null ? "<init>" : actionName) + " -> " + state;
    }
}
