package com.ryuqq.statecheck.core.result;

/**
 * Final status of a model-checking run.
 *
 * <p><strong>Three groups:</strong></p>
 * <ul>
 *   <li><strong>Success:</strong> {@link #SUCCESS}</li>
 *   <li><strong>Violations</strong> (findings, always with a trace): {@link #INVARIANT_VIOLATION},
 *       {@link #DEADLOCK_VIOLATION}, {@link #LIVENESS_VIOLATION}</li>
 *   <li><strong>Run-level failures</strong> (partial result, no trace): {@link #RESOURCE_EXHAUSTED},
 *       {@link #EVALUATOR_TIMEOUT}, {@link #EVALUATOR_FAULT}, {@link #CANCELLED}</li>
 * </ul>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public enum ExplorationStatus {

    SUCCESS,

    INVARIANT_VIOLATION,

    DEADLOCK_VIOLATION,

    LIVENESS_VIOLATION,

    RESOURCE_EXHAUSTED,

    EVALUATOR_TIMEOUT,

    EVALUATOR_FAULT,

    CANCELLED;

    /**
     * Whether this status is a finding that carries a counterexample.
     *
     * @return true for the three violation statuses
     */
    public boolean isViolation() {
        return this == INVARIANT_VIOLATION || this == DEADLOCK_VIOLATION || this == LIVENESS_VIOLATION;
    }

    /**
     * Whether the run ended before the state space was fully checked.
     *
     * @return true for exhaustion, evaluator failures and cancellation
     */
    public boolean isFailure() {
        return this == RESOURCE_EXHAUSTED || this == EVALUATOR_TIMEOUT
            || this == EVALUATOR_FAULT || this == CANCELLED;
    }
}
