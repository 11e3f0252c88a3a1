package com.ryuqq.statecheck.core.config;

/**
 * Run configuration (immutable record).
 *
 * <p>Every switch that influences a run lives here, never in process-wide state, so a
 * checker is reentrant and two runs with different settings can proceed side by side.</p>
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>checkDeadlock: report states without successors (default true)</li>
 *   <li>maxStates: distinct-state budget, exceeding it ends the run as RESOURCE_EXHAUSTED (default 1,000,000)</li>
 *   <li>stopOnFirstViolation: halt on the first invariant or deadlock violation (default true)</li>
 *   <li>evaluatorTimeoutMs: budget per action evaluation, 0 means unbounded (default 0)</li>
 *   <li>cancellationToken: cooperative cancellation (default: a token nobody holds)</li>
 * </ul>
 *
 * @param checkDeadlock whether deadlocks are violations
 * @param maxStates maximum number of distinct states (positive)
 * @param stopOnFirstViolation whether to halt on the first safety violation
 * @param evaluatorTimeoutMs per-call evaluation budget in milliseconds (0 = unbounded, never negative)
 * @param cancellationToken cancellation signal checked at each frontier pop
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record CheckerConfig(
    boolean checkDeadlock,
    int maxStates,
    boolean stopOnFirstViolation,
    long evaluatorTimeoutMs,
    CancellationToken cancellationToken
) {

    public static final int DEFAULT_MAX_STATES = 1_000_000;

    /**
     * Default settings.
     *
     * <p>checkDeadlock=true, maxStates=1,000,000, stopOnFirstViolation=true,
     * evaluatorTimeoutMs=0 (unbounded), cancellationToken=none</p>
     */
    public CheckerConfig() {
        this(true, DEFAULT_MAX_STATES, true, 0, CancellationToken.none());
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a setting is out of range
     */
    public CheckerConfig {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates must be positive (current: " + maxStates + ")");
        }
        if (evaluatorTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "evaluatorTimeoutMs cannot be negative (current: " + evaluatorTimeoutMs + ")");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
    }

    public boolean hasEvaluatorTimeout() {
        return evaluatorTimeoutMs > 0;
    }

    public CheckerConfig withCheckDeadlock(boolean checkDeadlock) {
        return new CheckerConfig(checkDeadlock, maxStates, stopOnFirstViolation, evaluatorTimeoutMs, cancellationToken);
    }

    public CheckerConfig withMaxStates(int maxStates) {
        return new CheckerConfig(checkDeadlock, maxStates, stopOnFirstViolation, evaluatorTimeoutMs, cancellationToken);
    }

    public CheckerConfig withStopOnFirstViolation(boolean stopOnFirstViolation) {
        return new CheckerConfig(checkDeadlock, maxStates, stopOnFirstViolation, evaluatorTimeoutMs, cancellationToken);
    }

    public CheckerConfig withEvaluatorTimeoutMs(long evaluatorTimeoutMs) {
        return new CheckerConfig(checkDeadlock, maxStates, stopOnFirstViolation, evaluatorTimeoutMs, cancellationToken);
    }

    public CheckerConfig withCancellationToken(CancellationToken cancellationToken) {
        return new CheckerConfig(checkDeadlock, maxStates, stopOnFirstViolation, evaluatorTimeoutMs, cancellationToken);
    }
}
