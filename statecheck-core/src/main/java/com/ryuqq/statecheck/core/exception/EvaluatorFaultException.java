package com.ryuqq.statecheck.core.exception;

/**
 * A user-supplied action or predicate threw, or returned a malformed result.
 *
 * <p>Aborts the run with {@code EVALUATOR_FAULT}. A faulting action is never treated as
 * disabled.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public class EvaluatorFaultException extends RuntimeException {

    private final String evaluatorName;

    public EvaluatorFaultException(String evaluatorName, String message) {
        super(message);
        this.evaluatorName = evaluatorName;
    }

    public EvaluatorFaultException(String evaluatorName, String message, Throwable cause) {
        super(message, cause);
        this.evaluatorName = evaluatorName;
    }

    /**
     * Whether a throwable raised by user code is a fault of that code.
     *
     * <p>Exceptions and errors such as {@link AssertionError} or {@link StackOverflowError}
     * are faults. Other {@link VirtualMachineError}s (out of memory, internal errors)
     * concern the whole JVM and keep propagating.</p>
     *
     * @param thrown what the user code threw
     * @return true if it should abort the run as {@code EVALUATOR_FAULT}
     */
    public static boolean isFault(Throwable thrown) {
        return !(thrown instanceof VirtualMachineError) || thrown instanceof StackOverflowError;
    }

    /**
     * Name of the action, invariant, constraint or property that faulted.
     */
    public String getEvaluatorName() {
        return evaluatorName;
    }
}
