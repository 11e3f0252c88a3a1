package com.ryuqq.statecheck.application.liveness;

import com.ryuqq.statecheck.core.graph.Edge;

import java.util.List;

/**
 * A reachable fair cycle that refutes a temporal property.
 *
 * <p>The behavior is: the discovery path to {@code anchorId}, then {@code stem} to
 * {@code entryId}, then forever around a cycle of {@code component} through the entry.</p>
 *
 * @param propertyName violated property
 * @param anchorId state where the obligation starts
 * @param stem edges from the anchor to the entry, inside the allowed sub-graph (may be empty)
 * @param entryId first state of the cycle
 * @param component fair component containing the entry
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record LivenessViolation(String propertyName, int anchorId, List<Edge> stem, int entryId,
                                FairComponent component) {

    public LivenessViolation {
        if (propertyName == null || propertyName.isBlank()) {
            throw new IllegalArgumentException("propertyName cannot be null or blank");
        }
        if (component == null || !component.contains(entryId)) {
            throw new IllegalArgumentException("entry " + entryId + " must belong to the component");
        }
        stem = stem == null ? List.of() : List.copyOf(stem);
        int end = stem.isEmpty() ? anchorId : stem.get(stem.size() - 1).targetId();
        if (end != entryId) {
            throw new IllegalArgumentException("stem must lead from " + anchorId + " to " + entryId);
        }
    }
}
