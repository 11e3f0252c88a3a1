package com.ryuqq.statecheck.application.checker;

import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.result.ExplorationResult;

/**
 * Entry point of a model-checking run.
 *
 * <p>A checker is bound to one {@code Model} and can be run any number of times; each
 * run uses a fresh state store and frontier, and all settings come from the
 * {@link CheckerConfig} passed in.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ModelChecker checker = new DefaultModelChecker(model, new SequentialExplorer());
 * ExplorationResult result = checker.run(new CheckerConfig().withMaxStates(10_000));
 *
 * if (result.getStatus() == ExplorationStatus.INVARIANT_VIOLATION) {
 *     CounterexampleTrace trace = result.getTrace().orElseThrow();
 * }
 * </pre>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public interface ModelChecker {

    /**
     * Explores the model and checks invariants, deadlock freedom and temporal properties.
     *
     * <p><strong>Run phases:</strong></p>
     * <ol>
     *   <li>Breadth-first exploration from all initial states, checking invariants and deadlocks</li>
     *   <li>If exploration completed without violation: liveness analysis per property, in declaration order</li>
     *   <li>Trace reconstruction for the reported violation</li>
     * </ol>
     *
     * <p>Violations and run-level failures are reported through the result status, never
     * thrown.</p>
     *
     * @param config run configuration
     * @return run report
     * @throws IllegalArgumentException if config is null
     */
    ExplorationResult run(CheckerConfig config);
}
