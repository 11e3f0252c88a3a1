/**
 * In-memory {@link com.ryuqq.statecheck.core.spi.StateStore} implementation.
 *
 * <p>One store per run; it is dropped with the run's result.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.adapter.inmemory.store;
