package com.ryuqq.statecheck.application.evaluator;

import com.ryuqq.statecheck.core.spec.Successor;

/**
 * One successor together with the action that produced it.
 *
 * @param actionIndex declaration index of the action
 * @param actionName action name
 * @param successor labeled successor state
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record GeneratedSuccessor(int actionIndex, String actionName, Successor successor) {

    public GeneratedSuccessor {
        if (actionIndex < 0) {
            throw new IllegalArgumentException("actionIndex cannot be negative (current: " + actionIndex + ")");
        }
        if (actionName == null || successor == null) {
            throw new IllegalArgumentException("actionName and successor cannot be null");
        }
    }
}
