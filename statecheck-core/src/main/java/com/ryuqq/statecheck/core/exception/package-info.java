/**
 * Unchecked exceptions raised by model declaration and evaluation.
 *
 * <p>Violations (invariant, deadlock, liveness) are findings and are never exceptions;
 * they are reported through {@code ExplorationResult}. The exceptions here describe
 * configuration errors and faults of user-supplied code.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.core.exception;
