package com.ryuqq.statecheck.core.check;

import com.ryuqq.statecheck.core.exception.EvaluatorFaultException;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spec.Constraint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintFilterTest {

    private final State state = State.of("a", 20, "b", 50);

    @Test
    void admits_AllConstraintsMustHold() {
        ConstraintFilter filter = new ConstraintFilter(List.of(
            Constraint.of("SmallA", s -> s.getLong("a") < 100),
            Constraint.of("SmallB", s -> s.getLong("b") < 50)));

        assertThat(filter.admits(state)).isFalse();
        assertThat(filter.admits(State.of("a", 1, "b", 1))).isTrue();
    }

    @Test
    void admits_NoConstraints_AdmitsEverything() {
        assertThat(new ConstraintFilter(List.of()).admits(state)).isTrue();
    }

    @Test
    void admits_ThrowingPredicate_WrappedAsFault() {
        ConstraintFilter filter = new ConstraintFilter(List.of(
            Constraint.of("Bounded", s -> s.getLong("missing") < 10)));

        assertThatThrownBy(() -> filter.admits(state))
            .isInstanceOf(EvaluatorFaultException.class)
            .hasMessageContaining("Bounded")
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void admits_FirstRejectionStopsEvaluation() {
        ConstraintFilter filter = new ConstraintFilter(List.of(
            Constraint.of("Never", s -> false),
            Constraint.of("Unreached", s -> {
                throw new IllegalStateException("evaluated after a rejection");
            })));

        assertThat(filter.admits(state)).isFalse();
    }

    @Test
    void constructor_NullList_Rejected() {
        assertThatThrownBy(() -> new ConstraintFilter(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
