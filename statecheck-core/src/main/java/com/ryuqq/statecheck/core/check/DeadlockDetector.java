package com.ryuqq.statecheck.core.check;

/**
 * Flags fully expanded states that have no successor at all.
 *
 * <p>Only a state whose every action returned an empty list is a deadlock. A state with
 * an explicit stutter successor is not. Constraint-pruned states are never expanded and
 * therefore never reach this detector.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class DeadlockDetector {

    /**
     * Name reported as {@code violatedName} for deadlock violations.
     */
    public static final String VIOLATION_NAME = "Deadlock";

    private final boolean enabled;

    /**
     * @param enabled false for designs that terminate on purpose
     */
    public DeadlockDetector(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @param successorCount successors produced across all actions of a fully expanded state
     * @return true if deadlock checking is enabled and there is no successor
     */
    public boolean isDeadlock(int successorCount) {
        if (successorCount < 0) {
            throw new IllegalArgumentException("successorCount cannot be negative (current: " + successorCount + ")");
        }
        return enabled && successorCount == 0;
    }
}
