package com.ryuqq.statecheck.core.exception;

/**
 * Malformed model declaration, detected before exploration starts.
 *
 * <p>Raised for blank or duplicate names, missing or duplicate initial states and
 * fairness assumptions referring to undeclared actions. Never raised mid-run.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public class ModelConfigurationException extends IllegalArgumentException {

    public ModelConfigurationException(String message) {
        super(message);
    }
}
