/**
 * Run configuration.
 *
 * <p>{@link com.ryuqq.statecheck.core.config.CheckerConfig} carries every run-level switch,
 * {@link com.ryuqq.statecheck.core.config.CancellationToken} the caller's cancellation signal.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.core.config;
