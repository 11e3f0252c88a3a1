package com.ryuqq.statecheck.core.result;

import com.ryuqq.statecheck.core.model.CounterexampleTrace;

import java.util.List;
import java.util.Optional;

/**
 * Report of a model-checking run.
 *
 * <p><strong>Three shapes:</strong></p>
 * <ul>
 *   <li><strong>success:</strong> status SUCCESS, counters only</li>
 *   <li><strong>violation:</strong> violated name, trace, and for invariants all invariants failing on the state</li>
 *   <li><strong>failure:</strong> partial counters and an error message, never a trace</li>
 * </ul>
 *
 * <p><strong>Counters:</strong></p>
 * <ul>
 *   <li>statesExplored: states whose successors were fully enumerated</li>
 *   <li>statesGenerated: initial states plus every successor produced, duplicates included</li>
 *   <li>distinctStates: states interned in the StateStore</li>
 * </ul>
 *
 * <p><strong>Immutability:</strong> no state changes after creation.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class ExplorationResult {

    private final ExplorationStatus status;
    private final long statesExplored;
    private final long statesGenerated;
    private final int distinctStates;
    private final String violatedNameOrNull;
    private final List<String> failedInvariants;
    private final CounterexampleTrace traceOrNull;
    private final String errorMessageOrNull;
    private final long elapsedMs;

    private ExplorationResult(ExplorationStatus status, long statesExplored, long statesGenerated,
                              int distinctStates, String violatedNameOrNull, List<String> failedInvariants,
                              CounterexampleTrace traceOrNull, String errorMessageOrNull, long elapsedMs) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (statesExplored < 0 || statesGenerated < 0 || distinctStates < 0 || elapsedMs < 0) {
            throw new IllegalArgumentException("counters cannot be negative");
        }
        this.status = status;
        this.statesExplored = statesExplored;
        this.statesGenerated = statesGenerated;
        this.distinctStates = distinctStates;
        this.violatedNameOrNull = violatedNameOrNull;
        this.failedInvariants = failedInvariants == null ? List.of() : List.copyOf(failedInvariants);
        this.traceOrNull = traceOrNull;
        this.errorMessageOrNull = errorMessageOrNull;
        this.elapsedMs = elapsedMs;
    }

    /**
     * Creates a successful result.
     */
    public static ExplorationResult success(long statesExplored, long statesGenerated, int distinctStates,
                                            long elapsedMs) {
        return new ExplorationResult(ExplorationStatus.SUCCESS, statesExplored, statesGenerated, distinctStates,
            null, List.of(), null, null, elapsedMs);
    }

    /**
     * Creates a violation result.
     *
     * @param status one of the violation statuses
     * @param violatedName canonical violated invariant or property name
     * @param failedInvariants all invariants failing on the offending state (empty for deadlock and liveness)
     * @param trace counterexample
     * @throws IllegalArgumentException if status is not a violation, or name or trace is missing
     */
    public static ExplorationResult violation(ExplorationStatus status, String violatedName,
                                              List<String> failedInvariants, CounterexampleTrace trace,
                                              long statesExplored, long statesGenerated, int distinctStates,
                                              long elapsedMs) {
        if (status == null || !status.isViolation()) {
            throw new IllegalArgumentException("status must be a violation status (current: " + status + ")");
        }
        if (violatedName == null || violatedName.isBlank()) {
            throw new IllegalArgumentException("violatedName cannot be null or blank");
        }
        if (trace == null) {
            throw new IllegalArgumentException("a violation must carry a counterexample trace");
        }
        if (status == ExplorationStatus.LIVENESS_VIOLATION && !trace.isLasso()) {
            throw new IllegalArgumentException("a liveness violation must carry a lasso trace");
        }
        return new ExplorationResult(status, statesExplored, statesGenerated, distinctStates,
            violatedName, failedInvariants, trace, null, elapsedMs);
    }

    /**
     * Creates a run-level failure result with partial counters.
     *
     * @param status one of the failure statuses
     * @param errorMessage what stopped the run
     * @throws IllegalArgumentException if status is not a failure status
     */
    public static ExplorationResult failure(ExplorationStatus status, String errorMessage,
                                            long statesExplored, long statesGenerated, int distinctStates,
                                            long elapsedMs) {
        if (status == null || !status.isFailure()) {
            throw new IllegalArgumentException("status must be a failure status (current: " + status + ")");
        }
        return new ExplorationResult(status, statesExplored, statesGenerated, distinctStates,
            null, List.of(), null, errorMessage, elapsedMs);
    }

    public ExplorationStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == ExplorationStatus.SUCCESS;
    }

    public long getStatesExplored() {
        return statesExplored;
    }

    public long getStatesGenerated() {
        return statesGenerated;
    }

    public int getDistinctStates() {
        return distinctStates;
    }

    public Optional<String> getViolatedName() {
        return Optional.ofNullable(violatedNameOrNull);
    }

    public List<String> getFailedInvariants() {
        return failedInvariants;
    }

    public Optional<CounterexampleTrace> getTrace() {
        return Optional.ofNullable(traceOrNull);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessageOrNull);
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public String toString() {
        return "ExplorationResult{" +
            "status=" + status +
            ", statesExplored=" + statesExplored +
            ", statesGenerated=" + statesGenerated +
            ", distinctStates=" + distinctStates +
            (violatedNameOrNull == null ? "" : ", violatedName=" + violatedNameOrNull) +
            (traceOrNull == null ? "" : ", traceLength=" + traceOrNull.length()) +
            (errorMessageOrNull == null ? "" : ", error=" + errorMessageOrNull) +
            ", elapsedMs=" + elapsedMs +
            '}';
    }
}
