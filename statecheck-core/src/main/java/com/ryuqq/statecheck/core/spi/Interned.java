package com.ryuqq.statecheck.core.spi;

/**
 * The state is present in the store.
 *
 * @param id dense state id (0-based, assigned in interning order)
 * @param isNew true only for the single call that inserted the state
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record Interned(int id, boolean isNew) implements InternResult {

    public Interned {
        if (id < 0) {
            throw new IllegalArgumentException("id cannot be negative (current: " + id + ")");
        }
    }
}
