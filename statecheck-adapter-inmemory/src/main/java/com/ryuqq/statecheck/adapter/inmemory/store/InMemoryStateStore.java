package com.ryuqq.statecheck.adapter.inmemory.store;

import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spi.Exhausted;
import com.ryuqq.statecheck.core.spi.InternResult;
import com.ryuqq.statecheck.core.spi.Interned;
import com.ryuqq.statecheck.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Heap-backed implementation of {@link StateStore}.
 *
 * <p>Interning uses {@link ConcurrentHashMap#computeIfAbsent} for an atomic
 * get-or-create: the mapping function runs at most once per distinct state, so exactly
 * one concurrent caller observes {@code isNew=true}.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>ids:</strong> ConcurrentHashMap&lt;State, Integer&gt; - keyed by canonical content
 *       ({@link State#equals} compares canonical forms, so hash collisions are resolved by content)</li>
 *   <li><strong>states:</strong> ConcurrentHashMap&lt;Integer, State&gt; - reverse lookup for traces</li>
 *   <li><strong>nextId:</strong> AtomicInteger - dense id counter, never advanced past the capacity</li>
 * </ul>
 *
 * <p><strong>Bounded growth:</strong> when the capacity is reached, the mapping function
 * returns null, {@code computeIfAbsent} inserts nothing, and {@link Exhausted} is
 * returned. Known states are still found.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StateStore store = new InMemoryStateStore(1_000);
 *
 * InternResult first = store.intern(State.of("a", 1));   // Interned(0, true)
 * InternResult again = store.intern(State.of("a", 1L));  // Interned(0, false)
 * </pre>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final int maxStates;
    private final ConcurrentHashMap<State, Integer> ids;
    private final ConcurrentHashMap<Integer, State> states;
    private final AtomicInteger nextId;
    private final AtomicBoolean exhaustionLogged;

    /**
     * @param maxStates maximum number of distinct states
     * @throws IllegalArgumentException if maxStates is not positive
     */
    public InMemoryStateStore(int maxStates) {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates must be positive (current: " + maxStates + ")");
        }
        this.maxStates = maxStates;
        this.ids = new ConcurrentHashMap<>();
        this.states = new ConcurrentHashMap<>();
        this.nextId = new AtomicInteger();
        this.exhaustionLogged = new AtomicBoolean(false);
    }

    @Override
    public InternResult intern(State state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        Integer known = ids.get(state);
        if (known != null) {
            return new Interned(known, false);
        }

        boolean[] created = new boolean[1];
        Integer id = ids.computeIfAbsent(state, s -> {
            int candidate = nextId.getAndUpdate(n -> n < maxStates ? n + 1 : n);
            if (candidate >= maxStates) {
                return null;
            }
            states.put(candidate, s);
            created[0] = true;
            return candidate;
        });

        if (id == null) {
            if (exhaustionLogged.compareAndSet(false, true)) {
                log.warn("State store exhausted: {} distinct states", maxStates);
            }
            return new Exhausted(maxStates);
        }
        return new Interned(id, created[0]);
    }

    @Override
    public State get(int id) {
        State state = states.get(id);
        if (state == null) {
            throw new IllegalArgumentException("Unknown state id: " + id);
        }
        return state;
    }

    @Override
    public int size() {
        return nextId.get();
    }

    @Override
    public int capacity() {
        return maxStates;
    }
}
