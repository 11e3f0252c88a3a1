package com.ryuqq.statecheck.application.exploration;

import com.ryuqq.statecheck.core.graph.ExplorationGraph;
import com.ryuqq.statecheck.core.result.ExplorationStatus;

import java.util.Optional;

/**
 * What an {@link Explorer} learned about a model.
 *
 * <p><strong>Status:</strong></p>
 * <ul>
 *   <li>SUCCESS: the frontier emptied and no safety violation was seen</li>
 *   <li>INVARIANT_VIOLATION / DEADLOCK_VIOLATION: {@link #getViolation()} holds the first one found</li>
 *   <li>failure statuses: {@link #getErrorMessage()} explains what stopped the run</li>
 * </ul>
 *
 * <p>A safety violation found before a run-level failure is still reported as the
 * violation (see {@link #failed}).</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class ExplorationOutcome {

    private final ExplorationStatus status;
    private final long statesExplored;
    private final long statesGenerated;
    private final SafetyViolation violationOrNull;
    private final String errorMessageOrNull;
    private final ExplorationGraph graph;

    private ExplorationOutcome(ExplorationStatus status, long statesExplored, long statesGenerated,
                               SafetyViolation violationOrNull, String errorMessageOrNull,
                               ExplorationGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        this.status = status;
        this.statesExplored = statesExplored;
        this.statesGenerated = statesGenerated;
        this.violationOrNull = violationOrNull;
        this.errorMessageOrNull = errorMessageOrNull;
        this.graph = graph;
    }

    /**
     * Exploration ran to the end (or halted on a violation).
     *
     * @param violationOrNull first safety violation, null if none
     */
    public static ExplorationOutcome completed(long statesExplored, long statesGenerated,
                                               SafetyViolation violationOrNull, ExplorationGraph graph) {
        ExplorationStatus status = violationOrNull == null ? ExplorationStatus.SUCCESS : violationOrNull.status();
        return new ExplorationOutcome(status, statesExplored, statesGenerated, violationOrNull, null, graph);
    }

    /**
     * Exploration stopped on a run-level failure.
     *
     * <p>If a safety violation had already been recorded (possible when exploration
     * continues after violations), the outcome reports that violation instead: its trace
     * is complete and remains valid.</p>
     *
     * @param status failure status
     * @param errorMessage what stopped the run
     * @param violationOrNull earlier safety violation, null if none
     */
    public static ExplorationOutcome failed(ExplorationStatus status, String errorMessage,
                                            long statesExplored, long statesGenerated,
                                            SafetyViolation violationOrNull, ExplorationGraph graph) {
        if (status == null || !status.isFailure()) {
            throw new IllegalArgumentException("status must be a failure status (current: " + status + ")");
        }
        if (violationOrNull != null) {
            return new ExplorationOutcome(violationOrNull.status(), statesExplored, statesGenerated,
                violationOrNull, errorMessage, graph);
        }
        return new ExplorationOutcome(status, statesExplored, statesGenerated, null, errorMessage, graph);
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

    public Optional<SafetyViolation> getViolation() {
        return Optional.ofNullable(violationOrNull);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessageOrNull);
    }

    public ExplorationGraph getGraph() {
        return graph;
    }

    @Override
    public String toString() {
        return "ExplorationOutcome{status=" + status
            + ", statesExplored=" + statesExplored
            + ", statesGenerated=" + statesGenerated
            + (violationOrNull == null ? "" : ", violation=" + violationOrNull)
            + (errorMessageOrNull == null ? "" : ", error=" + errorMessageOrNull) + '}';
    }
}
