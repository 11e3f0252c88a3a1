package com.ryuqq.statecheck.core.check;

import com.ryuqq.statecheck.core.exception.EvaluatorFaultException;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spec.Constraint;

import java.util.List;

/**
 * Decides whether a freshly interned state may be expanded.
 *
 * <p>A state is admitted when all constraints hold (logical AND). A rejected state stays
 * in the store as a terminal leaf: it appears in traces and is checked against
 * invariants, but its successors are never computed and it is never a deadlock.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class ConstraintFilter {

    private final List<Constraint> constraints;

    public ConstraintFilter(List<Constraint> constraints) {
        if (constraints == null) {
            throw new IllegalArgumentException("constraints cannot be null");
        }
        this.constraints = List.copyOf(constraints);
    }

    /**
     * @param state freshly interned state
     * @return true if every constraint holds
     * @throws EvaluatorFaultException if a predicate throws
     */
    public boolean admits(State state) {
        for (Constraint constraint : constraints) {
            boolean holds;
            try {
                holds = constraint.admits(state);
            } catch (RuntimeException | Error e) {
                if (!EvaluatorFaultException.isFault(e)) {
                    throw e;
                }
                throw new EvaluatorFaultException(constraint.name(),
                    "Constraint " + constraint.name() + " threw on " + state + ": " + e.getMessage(), e);
            }
            if (!holds) {
                return false;
            }
        }
        return true;
    }
}
