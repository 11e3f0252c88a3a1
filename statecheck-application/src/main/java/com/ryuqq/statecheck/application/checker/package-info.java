/**
 * Model checker port.
 *
 * <p>{@link com.ryuqq.statecheck.application.checker.ModelChecker} is what callers hold;
 * {@code statecheck-adapter-runner} provides the implementation.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.application.checker;
