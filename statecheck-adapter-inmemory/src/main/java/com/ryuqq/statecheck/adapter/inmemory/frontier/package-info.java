/**
 * In-memory {@link com.ryuqq.statecheck.core.spi.Frontier} implementation.
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.adapter.inmemory.frontier;
