/**
 * Reusable contract tests for {@link com.ryuqq.statecheck.application.checker.ModelChecker}
 * implementations.
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.testkit.contract;
