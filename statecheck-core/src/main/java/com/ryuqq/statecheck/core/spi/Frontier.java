package com.ryuqq.statecheck.core.spi;

/**
 * Queue of discovered but not yet expanded state ids.
 *
 * <p>FIFO order makes exploration breadth-first, which is what guarantees shortest
 * counterexamples in single-threaded mode.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>FIFO: ids are polled in offer order</li>
 *   <li>Thread-safe: a worker pool offers and polls concurrently</li>
 *   <li>Non-blocking: {@link #poll()} returns {@link #EMPTY} instead of waiting</li>
 * </ul>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public interface Frontier {

    /**
     * Sentinel returned by {@link #poll()} when the frontier is empty.
     */
    int EMPTY = -1;

    /**
     * Appends a state id.
     *
     * @param stateId id of a state awaiting expansion
     * @throws IllegalArgumentException if stateId is negative
     */
    void offer(int stateId);

    /**
     * Removes and returns the oldest state id.
     *
     * @return state id, or {@link #EMPTY}
     */
    int poll();

    boolean isEmpty();

    int size();
}
