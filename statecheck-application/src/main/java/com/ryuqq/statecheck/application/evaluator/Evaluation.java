package com.ryuqq.statecheck.application.evaluator;

import java.util.BitSet;
import java.util.List;

/**
 * Every successor of one state, plus the actions that were enabled on it.
 *
 * @param successors successors in action declaration order, then successor order
 * @param enabledActions indexes of actions that produced at least one successor
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record Evaluation(List<GeneratedSuccessor> successors, BitSet enabledActions) {

    public Evaluation {
        if (successors == null || enabledActions == null) {
            throw new IllegalArgumentException("successors and enabledActions cannot be null");
        }
        successors = List.copyOf(successors);
        enabledActions = (BitSet) enabledActions.clone();
    }

    @Override
    public BitSet enabledActions() {
        return (BitSet) enabledActions.clone();
    }
}
