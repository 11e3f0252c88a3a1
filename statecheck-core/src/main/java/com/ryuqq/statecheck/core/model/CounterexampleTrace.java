package com.ryuqq.statecheck.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Counterexample produced for a violation.
 *
 * <p>A trace has two parts:</p>
 * <ul>
 *   <li><strong>prefix:</strong> a finite path starting at an initial state. For safety
 *       and deadlock violations the last prefix state is the offending state.</li>
 *   <li><strong>cycle:</strong> for liveness violations only, the repeating suffix of a lasso.
 *       It starts from the last prefix state and its last step returns to that state.</li>
 * </ul>
 *
 * <pre>
 * prefix:  s0 --a--&gt; s1 --b--&gt; s2
 * cycle:             s2 --c--&gt; s3 --d--&gt; s2   (repeats forever)
 * </pre>
 *
 * <p><strong>Invariant:</strong> every step is backed by a recorded transition; no step is
 * fabricated.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class CounterexampleTrace {

    private final List<TraceStep> prefix;
    private final List<TraceStep> cycle;

    private CounterexampleTrace(List<TraceStep> prefix, List<TraceStep> cycle) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix cannot be null or empty");
        }
        if (!prefix.get(0).isInitial()) {
            throw new IllegalArgumentException("prefix must start with an initial state");
        }
        for (int i = 1; i < prefix.size(); i++) {
            if (prefix.get(i).isInitial()) {
                throw new IllegalArgumentException("only the first prefix step may be an initial state (index " + i + ")");
            }
        }
        if (cycle == null) {
            throw new IllegalArgumentException("cycle cannot be null");
        }
        if (!cycle.isEmpty()) {
            State loopState = prefix.get(prefix.size() - 1).state();
            if (!cycle.get(cycle.size() - 1).state().equals(loopState)) {
                throw new IllegalArgumentException("cycle must return to the last prefix state " + loopState);
            }
            for (TraceStep step : cycle) {
                if (step.isInitial()) {
                    throw new IllegalArgumentException("cycle steps must carry an action");
                }
            }
        }
        this.prefix = List.copyOf(prefix);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Creates a finite trace (safety or deadlock violation).
     *
     * @param prefix steps from an initial state to the offending state
     * @return CounterexampleTrace without cycle
     * @throws IllegalArgumentException if prefix is empty or does not start at an initial state
     */
    public static CounterexampleTrace path(List<TraceStep> prefix) {
        return new CounterexampleTrace(prefix, List.of());
    }

    /**
     * Creates a lasso trace (liveness violation).
     *
     * @param prefix steps from an initial state to the cycle entry
     * @param cycle non-empty steps from the cycle entry back to itself
     * @return CounterexampleTrace with cycle
     * @throws IllegalArgumentException if cycle is empty or does not close on the last prefix state
     */
    public static CounterexampleTrace lasso(List<TraceStep> prefix, List<TraceStep> cycle) {
        if (cycle == null || cycle.isEmpty()) {
            throw new IllegalArgumentException("lasso cycle cannot be null or empty");
        }
        return new CounterexampleTrace(prefix, cycle);
    }

    public List<TraceStep> getPrefix() {
        return prefix;
    }

    public List<TraceStep> getCycle() {
        return cycle;
    }

    public boolean isLasso() {
        return !cycle.isEmpty();
    }

    /**
     * Last state of the prefix: the offending state, or the cycle entry for a lasso.
     */
    public State getFinalState() {
        return prefix.get(prefix.size() - 1).state();
    }

    /**
     * All steps, prefix followed by one traversal of the cycle.
     *
     * @return concatenated steps
     */
    public List<TraceStep> getSteps() {
        List<TraceStep> steps = new ArrayList<>(prefix.size() + cycle.size());
        steps.addAll(prefix);
        steps.addAll(cycle);
        return List.copyOf(steps);
    }

    public int length() {
        return prefix.size() + cycle.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CounterexampleTrace that = (CounterexampleTrace) o;
        return prefix.equals(that.prefix) && cycle.equals(that.cycle);
    }

    @Override
    public int hashCode() {
        return 31 * prefix.hashCode() + cycle.hashCode();
    }

    @Override
    public String toString() {
        return "CounterexampleTrace{prefix=" + prefix + (cycle.isEmpty() ? "" : ", cycle=" + cycle) + '}';
    }
}
