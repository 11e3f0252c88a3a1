package com.ryuqq.statecheck.core.spi;

/**
 * The state is new but the store already holds {@code limit} states.
 *
 * @param limit configured maximum number of distinct states
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record Exhausted(int limit) implements InternResult {
}
