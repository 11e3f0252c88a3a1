package com.ryuqq.statecheck.core.spi;

/**
 * Result of {@link StateStore#intern}.
 *
 * <ul>
 *   <li>{@link Interned}: the state has an id, and {@code isNew} tells whether this call created it</li>
 *   <li>{@link Exhausted}: the state was absent and the distinct-state budget is used up</li>
 * </ul>
 *
 * <p>Sealed interface, so callers handle both cases explicitly.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public sealed interface InternResult permits Interned, Exhausted {

    default boolean isExhausted() {
        return this instanceof Exhausted;
    }
}
