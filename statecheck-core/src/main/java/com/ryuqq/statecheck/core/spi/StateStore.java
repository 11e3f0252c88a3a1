package com.ryuqq.statecheck.core.spi;

import com.ryuqq.statecheck.core.model.State;

/**
 * State deduplication SPI.
 *
 * <p>The store canonicalizes discovered states and hands out dense integer ids, which the
 * rest of the engine uses to index flat arrays (parent pointers, adjacency lists).</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Deduplication by canonical content ({@link State#canonicalForm()})</li>
 *   <li>Dense id assignment: 0, 1, 2, ... in interning order</li>
 *   <li>Bounded growth: never more than the configured number of distinct states</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic intern: for any content, exactly one concurrent caller observes {@code isNew=true}</li>
 *   <li>Collision safe: equal hashes with different content are distinct states</li>
 *   <li>Thread-safe reads: {@link #get} may run concurrently with {@link #intern}</li>
 * </ul>
 *
 * <p>A store lives for exactly one run and is discarded afterwards.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Interns a state.
     *
     * <p>Returns the existing id with {@code isNew=false} if a structurally equal state is
     * already present; inserts the state and returns a fresh id with {@code isNew=true}
     * otherwise. If insertion would exceed the configured capacity, nothing is inserted and
     * {@link Exhausted} is returned.</p>
     *
     * @param state state to intern
     * @return {@link Interned} or {@link Exhausted}
     * @throws IllegalArgumentException if state is null
     */
    InternResult intern(State state);

    /**
     * Looks up a state by id.
     *
     * @param id state id returned by {@link #intern}
     * @return the interned state
     * @throws IllegalArgumentException if no state has this id
     */
    State get(int id);

    /**
     * Number of distinct states interned so far.
     *
     * @return distinct state count
     */
    int size();

    /**
     * Maximum number of distinct states this store accepts.
     *
     * @return capacity
     */
    int capacity();
}
