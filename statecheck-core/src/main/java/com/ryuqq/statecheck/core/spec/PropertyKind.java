package com.ryuqq.statecheck.core.spec;

/**
 * Temporal operator of a {@link TemporalProperty}.
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public enum PropertyKind {

    /**
     * {@code <>P}: every behavior reaches a state satisfying P.
     */
    EVENTUALLY,

    /**
     * {@code []<>P}: every behavior satisfies P infinitely often.
     */
    ALWAYS_EVENTUALLY,

    /**
     * {@code <>[]P}: every behavior eventually satisfies P forever.
     */
    EVENTUALLY_ALWAYS,

    /**
     * {@code P ~> Q}: whenever P holds, Q holds then or later.
     */
    LEADS_TO
}
