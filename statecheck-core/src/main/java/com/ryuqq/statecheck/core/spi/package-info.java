/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage abstractions the exploration engine is written
 * against. Adapter modules provide the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statecheck.core.spi.StateStore} - Canonicalizing, bounded state deduplication</li>
 *   <li>{@link com.ryuqq.statecheck.core.spi.Frontier} - FIFO queue of states awaiting expansion</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@code statecheck-adapter-inmemory} provides heap-backed implementations. Both SPIs
 * must be safe for concurrent use, since the worker-pool explorer shares them between
 * threads; they are the only shared mutable structures besides the recorded graph.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.core.spi;
