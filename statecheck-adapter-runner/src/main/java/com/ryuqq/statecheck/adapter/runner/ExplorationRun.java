package com.ryuqq.statecheck.adapter.runner;

import com.ryuqq.statecheck.application.evaluator.ActionEvaluator;
import com.ryuqq.statecheck.application.evaluator.Evaluation;
import com.ryuqq.statecheck.application.evaluator.GeneratedSuccessor;
import com.ryuqq.statecheck.application.exploration.ExplorationOutcome;
import com.ryuqq.statecheck.application.exploration.SafetyViolation;
import com.ryuqq.statecheck.core.check.ConstraintFilter;
import com.ryuqq.statecheck.core.check.DeadlockDetector;
import com.ryuqq.statecheck.core.check.InvariantChecker;
import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.exception.EvaluatorFaultException;
import com.ryuqq.statecheck.core.exception.EvaluatorTimeoutException;
import com.ryuqq.statecheck.core.exception.ExplorationCancelledException;
import com.ryuqq.statecheck.core.graph.Edge;
import com.ryuqq.statecheck.core.graph.ExplorationGraph;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.model.Transition;
import com.ryuqq.statecheck.core.result.ExplorationStatus;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spi.Frontier;
import com.ryuqq.statecheck.core.spi.InternResult;
import com.ryuqq.statecheck.core.spi.Interned;
import com.ryuqq.statecheck.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-run exploration state shared by all threads of one run.
 *
 * <p><strong>Per-state work:</strong></p>
 * <pre>
 * new state (isNew=true)             popped state
 *   record discovery transition        check cancellation
 *   check invariants                   evaluate all actions
 *   apply constraints                  intern successors, record every edge
 *   offer to frontier if admitted      record expansion, check deadlock
 * </pre>
 *
 * <p><strong>Halting:</strong> the first run-level failure (fault, timeout, exhausted
 * store, cancellation) and, with {@code stopOnFirstViolation}, the first safety
 * violation set the halt flag. Only the first of each is kept
 * ({@link AtomicReference#compareAndSet}).</p>
 *
 * <p>Thread-safe: counters are atomic, and the store, frontier and graph are
 * concurrent structures.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
final class ExplorationRun {

    private static final Logger log = LoggerFactory.getLogger(ExplorationRun.class);

    private final Model model;
    private final CheckerConfig config;
    private final StateStore store;
    private final Frontier frontier;
    private final ActionEvaluator evaluator;
    private final ExplorationGraph graph;
    private final InvariantChecker invariants;
    private final ConstraintFilter constraints;
    private final DeadlockDetector deadlocks;

    private final AtomicLong statesExplored = new AtomicLong();
    private final AtomicLong statesGenerated = new AtomicLong();
    private final AtomicReference<SafetyViolation> firstViolation = new AtomicReference<>();
    private final AtomicReference<Failure> failure = new AtomicReference<>();
    private final AtomicBoolean halted = new AtomicBoolean(false);

    ExplorationRun(Model model, CheckerConfig config, StateStore store, Frontier frontier,
                   ActionEvaluator evaluator) {
        if (model == null || config == null || store == null || frontier == null || evaluator == null) {
            throw new IllegalArgumentException("model, config, store, frontier and evaluator cannot be null");
        }
        this.model = model;
        this.config = config;
        this.store = store;
        this.frontier = frontier;
        this.evaluator = evaluator;
        this.graph = new ExplorationGraph(model.getActions().size());
        this.invariants = new InvariantChecker(model.getInvariants());
        this.constraints = new ConstraintFilter(model.getConstraints());
        this.deadlocks = new DeadlockDetector(config.checkDeadlock());
    }

    /**
     * Interns and checks the initial states in declaration order.
     */
    void seed() {
        guarded(() -> {
            for (State initial : model.getInitialStates()) {
                statesGenerated.incrementAndGet();
                InternResult result = store.intern(initial);
                if (!(result instanceof Interned interned)) {
                    exhausted();
                    return;
                }
                if (interned.isNew()) {
                    graph.recordInitial(interned.id());
                    onNewState(interned.id(), initial);
                }
                if (isHalted()) {
                    return;
                }
            }
        });
    }

    /**
     * Expands one popped state.
     *
     * @param stateId state taken from the frontier
     */
    void process(int stateId) {
        if (config.cancellationToken().isCancelled() || Thread.currentThread().isInterrupted()) {
            fail(ExplorationStatus.CANCELLED, "Run cancelled after " + statesExplored.get() + " expanded states");
            return;
        }
        guarded(() -> expand(stateId));
    }

    private void expand(int stateId) {
        State state = store.get(stateId);
        Evaluation evaluation = evaluator.evaluate(state);
        List<Edge> edges = new ArrayList<>(evaluation.successors().size());

        for (GeneratedSuccessor generated : evaluation.successors()) {
            statesGenerated.incrementAndGet();
            State next = generated.successor().state();
            String label = generated.successor().label();
            InternResult result = store.intern(next);
            if (!(result instanceof Interned interned)) {
                exhausted();
                return;
            }
            edges.add(new Edge(stateId, interned.id(), generated.actionIndex(), label));
            if (interned.isNew()) {
                graph.recordDiscovery(new Transition(stateId, generated.actionName(), label, interned.id()));
                onNewState(interned.id(), next);
                if (isHalted()) {
                    return;
                }
            }
        }

        graph.recordExpansion(stateId, edges, evaluation.enabledActions());
        statesExplored.incrementAndGet();
        if (deadlocks.isDeadlock(evaluation.successors().size())) {
            violation(SafetyViolation.deadlock(stateId, DeadlockDetector.VIOLATION_NAME));
        }
    }

    private void onNewState(int stateId, State state) {
        List<String> failed = invariants.failing(state);
        if (!failed.isEmpty()) {
            violation(SafetyViolation.invariant(stateId, failed));
            if (isHalted()) {
                return;
            }
        }
        if (constraints.admits(state)) {
            frontier.offer(stateId);
        }
    }

    private void guarded(Runnable work) {
        try {
            work.run();
        } catch (EvaluatorFaultException e) {
            fail(ExplorationStatus.EVALUATOR_FAULT, e.getMessage());
        } catch (EvaluatorTimeoutException e) {
            fail(ExplorationStatus.EVALUATOR_TIMEOUT, e.getMessage());
        } catch (ExplorationCancelledException e) {
            fail(ExplorationStatus.CANCELLED, e.getMessage());
        }
    }

    private void violation(SafetyViolation violation) {
        if (firstViolation.compareAndSet(null, violation)) {
            log.debug("{} at state {}", violation.name(), violation.stateId());
        }
        if (config.stopOnFirstViolation()) {
            halted.set(true);
        }
    }

    private void exhausted() {
        fail(ExplorationStatus.RESOURCE_EXHAUSTED,
            "State limit reached: " + store.capacity() + " distinct states");
    }

    void fail(ExplorationStatus status, String message) {
        if (failure.compareAndSet(null, new Failure(status, message))) {
            log.debug("Exploration halted: {} ({})", status, message);
        }
        halted.set(true);
    }

    boolean isHalted() {
        return halted.get();
    }

    ExplorationGraph graph() {
        return graph;
    }

    long statesExplored() {
        return statesExplored.get();
    }

    ExplorationOutcome outcome() {
        Failure f = failure.get();
        if (f != null) {
            return ExplorationOutcome.failed(f.status(), f.message(), statesExplored.get(), statesGenerated.get(),
                firstViolation.get(), graph);
        }
        return ExplorationOutcome.completed(statesExplored.get(), statesGenerated.get(), firstViolation.get(), graph);
    }

    private record Failure(ExplorationStatus status, String message) {
    }
}
