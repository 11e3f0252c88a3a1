/**
 * Per-state checks run by the explorer.
 *
 * <ul>
 *   <li>{@link com.ryuqq.statecheck.core.check.InvariantChecker} - on every newly discovered state</li>
 *   <li>{@link com.ryuqq.statecheck.core.check.ConstraintFilter} - before a new state may be queued</li>
 *   <li>{@link com.ryuqq.statecheck.core.check.DeadlockDetector} - after a state is fully expanded</li>
 * </ul>
 *
 * <p>All checks are pure, so in worker-pool mode it does not matter which thread runs them.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.core.check;
