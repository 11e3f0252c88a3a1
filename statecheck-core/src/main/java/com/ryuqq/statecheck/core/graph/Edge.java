package com.ryuqq.statecheck.core.graph;

/**
 * Labeled edge of the reachable state graph.
 *
 * <p>Unlike a discovery {@code Transition}, an Edge is recorded for every successor,
 * including successors that were already known. Liveness analysis needs all of them.</p>
 *
 * @param sourceId expanded state
 * @param targetId successor state
 * @param actionIndex declaration index of the action that produced the successor
 * @param label action-instance label
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record Edge(int sourceId, int targetId, int actionIndex, String label) {

    public Edge {
        if (sourceId < 0 || targetId < 0) {
            throw new IllegalArgumentException(
                "State ids cannot be negative (source: " + sourceId + ", target: " + targetId + ")");
        }
        if (actionIndex < 0) {
            throw new IllegalArgumentException("actionIndex cannot be negative (current: " + actionIndex + ")");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
    }

    public boolean isSelfLoop() {
        return sourceId == targetId;
    }
}
