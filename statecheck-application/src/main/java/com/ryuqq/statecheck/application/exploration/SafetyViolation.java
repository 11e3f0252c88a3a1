package com.ryuqq.statecheck.application.exploration;

import com.ryuqq.statecheck.core.result.ExplorationStatus;

import java.util.List;

/**
 * Invariant or deadlock violation found during exploration.
 *
 * @param status INVARIANT_VIOLATION or DEADLOCK_VIOLATION
 * @param stateId offending state
 * @param name first failing invariant, or "Deadlock"
 * @param failedInvariants every invariant failing on the state, in declaration order
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record SafetyViolation(ExplorationStatus status, int stateId, String name, List<String> failedInvariants) {

    public SafetyViolation {
        if (status != ExplorationStatus.INVARIANT_VIOLATION && status != ExplorationStatus.DEADLOCK_VIOLATION) {
            throw new IllegalArgumentException("status must be a safety violation (current: " + status + ")");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        failedInvariants = failedInvariants == null ? List.of() : List.copyOf(failedInvariants);
    }

    public static SafetyViolation invariant(int stateId, List<String> failedInvariants) {
        if (failedInvariants == null || failedInvariants.isEmpty()) {
            throw new IllegalArgumentException("failedInvariants cannot be null or empty");
        }
        return new SafetyViolation(ExplorationStatus.INVARIANT_VIOLATION, stateId, failedInvariants.get(0),
            failedInvariants);
    }

    public static SafetyViolation deadlock(int stateId, String name) {
        return new SafetyViolation(ExplorationStatus.DEADLOCK_VIOLATION, stateId, name, List.of());
    }
}
