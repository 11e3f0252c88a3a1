package com.ryuqq.statecheck.adapter.runner;

import com.ryuqq.statecheck.adapter.inmemory.frontier.InMemoryFrontier;
import com.ryuqq.statecheck.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.statecheck.application.checker.ModelChecker;
import com.ryuqq.statecheck.application.exploration.ExplorationOutcome;
import com.ryuqq.statecheck.application.exploration.Explorer;
import com.ryuqq.statecheck.application.exploration.SafetyViolation;
import com.ryuqq.statecheck.application.liveness.LivenessChecker;
import com.ryuqq.statecheck.application.liveness.LivenessViolation;
import com.ryuqq.statecheck.application.trace.TraceReconstructor;
import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.exception.EvaluatorFaultException;
import com.ryuqq.statecheck.core.graph.ReachableGraph;
import com.ryuqq.statecheck.core.model.CounterexampleTrace;
import com.ryuqq.statecheck.core.result.ExplorationResult;
import com.ryuqq.statecheck.core.result.ExplorationStatus;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spec.TemporalProperty;
import com.ryuqq.statecheck.core.spi.Frontier;
import com.ryuqq.statecheck.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * {@link ModelChecker} wiring exploration, liveness analysis and trace reconstruction.
 *
 * <p><strong>Run flow:</strong></p>
 * <pre>
 * run(config)
 *   ↓
 * fresh StateStore(maxStates) + Frontier
 *   ↓
 * explorer.explore(...)  → ExplorationOutcome
 *   ↓
 * safety violation?      → path trace        → INVARIANT_VIOLATION / DEADLOCK_VIOLATION
 * run-level failure?     → partial counters  → RESOURCE_EXHAUSTED / EVALUATOR_* / CANCELLED
 * otherwise, per property (declaration order):
 *   LivenessChecker      → lasso trace       → LIVENESS_VIOLATION
 *   ↓
 * SUCCESS
 * </pre>
 *
 * <p>The store and frontier live for one run only. The checker holds no per-run
 * state, so concurrent runs on one instance are independent.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class DefaultModelChecker implements ModelChecker {

    private static final Logger log = LoggerFactory.getLogger(DefaultModelChecker.class);

    private final Model model;
    private final Explorer explorer;
    private final IntFunction<StateStore> storeFactory;
    private final Supplier<Frontier> frontierFactory;

    /**
     * Creates a checker backed by the in-memory store and frontier.
     *
     * @param model model to check
     * @param explorer exploration strategy
     * @throws IllegalArgumentException if an argument is null
     */
    public DefaultModelChecker(Model model, Explorer explorer) {
        this(model, explorer, InMemoryStateStore::new, InMemoryFrontier::new);
    }

    /**
     * @param model model to check
     * @param explorer exploration strategy
     * @param storeFactory creates a store for the given capacity, once per run
     * @param frontierFactory creates an empty frontier, once per run
     * @throws IllegalArgumentException if an argument is null
     */
    public DefaultModelChecker(Model model, Explorer explorer, IntFunction<StateStore> storeFactory,
                               Supplier<Frontier> frontierFactory) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (explorer == null) {
            throw new IllegalArgumentException("explorer cannot be null");
        }
        if (storeFactory == null || frontierFactory == null) {
            throw new IllegalArgumentException("storeFactory and frontierFactory cannot be null");
        }
        this.model = model;
        this.explorer = explorer;
        this.storeFactory = storeFactory;
        this.frontierFactory = frontierFactory;
    }

    @Override
    public ExplorationResult run(CheckerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        long startNanos = System.nanoTime();
        log.info("Model check started: {} (maxStates={}, checkDeadlock={}, stopOnFirstViolation={})",
            model, config.maxStates(), config.checkDeadlock(), config.stopOnFirstViolation());

        StateStore store = storeFactory.apply(config.maxStates());
        ExplorationOutcome outcome = explorer.explore(model, config, store, frontierFactory.get());
        ExplorationResult result = report(config, store, outcome, startNanos);

        if (result.getStatus().isFailure()) {
            log.warn("Model check aborted: {}", result);
        } else {
            log.info("Model check finished: {}", result);
        }
        return result;
    }

    private ExplorationResult report(CheckerConfig config, StateStore store, ExplorationOutcome outcome,
                                     long startNanos) {
        TraceReconstructor traces = new TraceReconstructor(outcome.getGraph(), store::get);

        Optional<SafetyViolation> violation = outcome.getViolation();
        if (violation.isPresent()) {
            SafetyViolation v = violation.get();
            return ExplorationResult.violation(v.status(), v.name(), v.failedInvariants(),
                traces.safetyTrace(v.stateId()), outcome.getStatesExplored(), outcome.getStatesGenerated(),
                store.size(), elapsedMs(startNanos));
        }
        if (!outcome.isSuccess()) {
            return failure(outcome.getStatus(), outcome.getErrorMessage().orElse(null), outcome, store, startNanos);
        }
        if (model.getProperties().isEmpty()) {
            return success(outcome, store, startNanos);
        }

        ReachableGraph reachable = outcome.getGraph().freeze(store.size());
        LivenessChecker liveness = new LivenessChecker(reachable, model, store::get);
        for (TemporalProperty property : model.getProperties()) {
            if (config.cancellationToken().isCancelled()) {
                return failure(ExplorationStatus.CANCELLED, "Run cancelled before checking " + property.name(),
                    outcome, store, startNanos);
            }
            Optional<LivenessViolation> found;
            try {
                found = liveness.check(property);
            } catch (EvaluatorFaultException e) {
                return failure(ExplorationStatus.EVALUATOR_FAULT, e.getMessage(), outcome, store, startNanos);
            }
            if (found.isPresent()) {
                CounterexampleTrace trace = traces.lassoTrace(found.get(), reachable);
                return ExplorationResult.violation(ExplorationStatus.LIVENESS_VIOLATION, property.name(),
                    List.of(), trace, outcome.getStatesExplored(), outcome.getStatesGenerated(),
                    store.size(), elapsedMs(startNanos));
            }
        }
        return success(outcome, store, startNanos);
    }

    private static ExplorationResult success(ExplorationOutcome outcome, StateStore store, long startNanos) {
        return ExplorationResult.success(outcome.getStatesExplored(), outcome.getStatesGenerated(), store.size(),
            elapsedMs(startNanos));
    }

    private static ExplorationResult failure(ExplorationStatus status, String message, ExplorationOutcome outcome,
                                             StateStore store, long startNanos) {
        return ExplorationResult.failure(status, message, outcome.getStatesExplored(),
            outcome.getStatesGenerated(), store.size(), elapsedMs(startNanos));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
