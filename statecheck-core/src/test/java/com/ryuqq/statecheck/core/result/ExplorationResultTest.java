package com.ryuqq.statecheck.core.result;

import com.ryuqq.statecheck.core.model.CounterexampleTrace;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.model.TraceStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExplorationResultTest {

    private final CounterexampleTrace path = CounterexampleTrace.path(List.of(TraceStep.initial(State.of("n", 0))));

    @Test
    void success_HasNoTraceOrName() {
        ExplorationResult result = ExplorationResult.success(4, 7, 4, 3);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTrace()).isEmpty();
        assertThat(result.getViolatedName()).isEmpty();
        assertThat(result.getStatesGenerated()).isEqualTo(7);
    }

    @Test
    void violation_InvariantCarriesAllFailingNames() {
        ExplorationResult result = ExplorationResult.violation(ExplorationStatus.INVARIANT_VIOLATION, "A",
            List.of("A", "B"), path, 0, 1, 1, 0);

        assertThat(result.getStatus().isViolation()).isTrue();
        assertThat(result.getViolatedName()).contains("A");
        assertThat(result.getFailedInvariants()).containsExactly("A", "B");
        assertThat(result.getTrace()).contains(path);
    }

    @Test
    void violation_LivenessWithoutLasso_ThrowsException() {
        assertThatThrownBy(() -> ExplorationResult.violation(ExplorationStatus.LIVENESS_VIOLATION, "P",
            List.of(), path, 1, 1, 1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lasso");
    }

    @Test
    void failure_NonFailureStatus_ThrowsException() {
        assertThatThrownBy(() -> ExplorationResult.failure(ExplorationStatus.SUCCESS, "x", 0, 0, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failure_KeepsPartialCounters() {
        ExplorationResult result = ExplorationResult.failure(ExplorationStatus.RESOURCE_EXHAUSTED,
            "limit 10 reached", 9, 20, 10, 5);

        assertThat(result.getStatus().isFailure()).isTrue();
        assertThat(result.getDistinctStates()).isEqualTo(10);
        assertThat(result.getErrorMessage()).contains("limit 10 reached");
        assertThat(result.getTrace()).isEmpty();
    }
}
