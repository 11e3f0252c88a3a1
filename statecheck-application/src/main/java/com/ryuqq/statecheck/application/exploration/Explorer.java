package com.ryuqq.statecheck.application.exploration;

import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spi.Frontier;
import com.ryuqq.statecheck.core.spi.StateStore;

/**
 * Breadth-first state-space exploration strategy.
 *
 * <p>Implementations differ only in how they drain the frontier (one thread or a pool);
 * the per-state work is the same:</p>
 * <ul>
 *   <li><strong>New state:</strong> record discovery transition, check invariants, apply constraints, enqueue</li>
 *   <li><strong>Popped state:</strong> check cancellation, evaluate successors, record every edge, check deadlock</li>
 * </ul>
 *
 * <p>Run-level problems (evaluator fault or timeout, exhausted store, cancellation) end
 * the exploration and are reported in the outcome, not thrown.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public interface Explorer {

    /**
     * Explores the reachable state space of a model.
     *
     * @param model model to explore
     * @param config run configuration
     * @param store empty state store for this run
     * @param frontier empty frontier for this run
     * @return exploration outcome, including the recorded graph
     */
    ExplorationOutcome explore(Model model, CheckerConfig config, StateStore store, Frontier frontier);
}
