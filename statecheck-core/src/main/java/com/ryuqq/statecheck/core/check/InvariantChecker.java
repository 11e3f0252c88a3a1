package com.ryuqq.statecheck.core.check;

import com.ryuqq.statecheck.core.exception.EvaluatorFaultException;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spec.Invariant;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every configured invariant against a newly discovered state.
 *
 * <p>All invariants are evaluated, not just the first failing one, so a report can list
 * every invariant broken by the offending state. The first failing invariant in
 * declaration order is the canonical violation.</p>
 *
 * <p>Stateless and thread-safe as long as the predicates are.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class InvariantChecker {

    private final List<Invariant> invariants;

    /**
     * @param invariants invariants in declaration order
     * @throws IllegalArgumentException if invariants is null
     */
    public InvariantChecker(List<Invariant> invariants) {
        if (invariants == null) {
            throw new IllegalArgumentException("invariants cannot be null");
        }
        this.invariants = List.copyOf(invariants);
    }

    /**
     * Names of the invariants that fail on a state.
     *
     * @param state state to check
     * @return failing invariant names in declaration order, empty if all hold
     * @throws EvaluatorFaultException if a predicate throws
     */
    public List<String> failing(State state) {
        List<String> failed = new ArrayList<>(0);
        for (Invariant invariant : invariants) {
            boolean holds;
            try {
                holds = invariant.holds(state);
            } catch (RuntimeException | Error e) {
                if (!EvaluatorFaultException.isFault(e)) {
                    throw e;
                }
                throw new EvaluatorFaultException(invariant.name(),
                    "Invariant " + invariant.name() + " threw on " + state + ": " + e.getMessage(), e);
            }
            if (!holds) {
                failed.add(invariant.name());
            }
        }
        return failed;
    }
}
