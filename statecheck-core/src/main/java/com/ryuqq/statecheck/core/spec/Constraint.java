package com.ryuqq.statecheck.core.spec;

import com.ryuqq.statecheck.core.model.State;

import java.util.function.Predicate;

/**
 * Named pruning predicate.
 *
 * <p>States failing a constraint are still recorded and checked, but never expanded.
 * Typical use is bounding an otherwise infinite model, e.g. {@code counter <= 10}.</p>
 *
 * @param name constraint name, unique within a model
 * @param predicate condition a state must satisfy to be expanded
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record Constraint(String name, Predicate<State> predicate) {

    public Constraint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Constraint name cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
    }

    public static Constraint of(String name, Predicate<State> predicate) {
        return new Constraint(name, predicate);
    }

    public boolean admits(State state) {
        return predicate.test(state);
    }
}
