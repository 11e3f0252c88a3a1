package com.ryuqq.statecheck.core.exception;

/**
 * A run stopped because its cancellation token fired or its thread was interrupted.
 *
 * <p>Translated to the {@code CANCELLED} status at the checker boundary.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public class ExplorationCancelledException extends RuntimeException {

    public ExplorationCancelledException(String message) {
        super(message);
    }

    public ExplorationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
