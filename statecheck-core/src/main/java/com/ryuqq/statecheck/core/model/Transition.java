package com.ryuqq.statecheck.core.model;

/**
 * Discovery edge of the reachable state graph.
 *
 * <p>A Transition is recorded exactly once per state, by whichever caller interned the
 * target first. Following transitions backward from any state leads to an initial state,
 * which is how counterexample traces are reconstructed.</p>
 *
 * @param sourceId id of the state the action was applied to
 * @param actionName declared name of the action
 * @param label action-instance label of the successor (equals actionName unless the action labels its choices)
 * @param targetId id of the discovered state
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record Transition(
    int sourceId,
    String actionName,
    String label,
    int targetId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if an id is negative or a name is blank
     */
    public Transition {
        if (sourceId < 0 || targetId < 0) {
            throw new IllegalArgumentException(
                "State ids cannot be negative (source: " + sourceId + ", target: " + targetId + ")");
        }
        if (actionName == null || actionName.isBlank()) {
            throw new IllegalArgumentException("actionName cannot be null or blank");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
    }
}
