package com.ryuqq.statecheck.core.exception;

/**
 * An action's successor enumeration exceeded the configured per-call budget.
 *
 * <p>Aborts the run with {@code EVALUATOR_TIMEOUT}; the slow call is never skipped silently.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public class EvaluatorTimeoutException extends RuntimeException {

    private final String actionName;
    private final long timeoutMs;

    public EvaluatorTimeoutException(String actionName, long timeoutMs) {
        super("Action " + actionName + " exceeded its evaluation budget of " + timeoutMs + "ms");
        this.actionName = actionName;
        this.timeoutMs = timeoutMs;
    }

    public String getActionName() {
        return actionName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
