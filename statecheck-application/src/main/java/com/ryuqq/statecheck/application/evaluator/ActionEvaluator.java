package com.ryuqq.statecheck.application.evaluator;

import com.ryuqq.statecheck.core.exception.EvaluatorFaultException;
import com.ryuqq.statecheck.core.exception.EvaluatorTimeoutException;
import com.ryuqq.statecheck.core.exception.ExplorationCancelledException;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spec.Action;
import com.ryuqq.statecheck.core.spec.Successor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enumerates the successors of a state across all actions.
 *
 * <p><strong>Order:</strong> actions in declaration order, and for each action its
 * successors in the order it returned them.</p>
 *
 * <p><strong>Failure handling:</strong></p>
 * <ul>
 *   <li>An action that throws, returns a null list or a null successor: {@link EvaluatorFaultException}</li>
 *   <li>An action call exceeding {@code timeoutMs}: {@link EvaluatorTimeoutException}</li>
 *   <li>The calling thread is interrupted while waiting: {@link ExplorationCancelledException}</li>
 * </ul>
 * <p>Failures are never treated as a disabled action.</p>
 *
 * <p><strong>Timeouts:</strong> with {@code timeoutMs > 0}, each action call runs on a
 * daemon thread of an internal pool and the caller waits at most {@code timeoutMs}
 * for the future. A timed-out call is cancelled with an interrupt; an action that
 * ignores interrupts keeps its daemon thread until it returns. With
 * {@code timeoutMs == 0} actions run on the calling thread.</p>
 *
 * <p>Thread-safe: one instance is shared by all workers of a run. Close it when the
 * run ends.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class ActionEvaluator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActionEvaluator.class);

    private final List<Action> actions;
    private final long timeoutMs;
    private final ExecutorService timeoutExecutor;

    /**
     * @param actions actions in declaration order
     * @param timeoutMs per-call budget in milliseconds, 0 for unbounded
     * @throws IllegalArgumentException if actions is null or timeoutMs is negative
     */
    public ActionEvaluator(List<Action> actions, long timeoutMs) {
        if (actions == null) {
            throw new IllegalArgumentException("actions cannot be null");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        this.actions = List.copyOf(actions);
        this.timeoutMs = timeoutMs;
        this.timeoutExecutor = timeoutMs > 0 ? Executors.newCachedThreadPool(daemonThreads()) : null;
    }

    /**
     * Evaluates every action on a state.
     *
     * @param state source state
     * @return successors and enabled actions
     * @throws EvaluatorFaultException if an action misbehaves
     * @throws EvaluatorTimeoutException if an action call exceeds its budget
     * @throws ExplorationCancelledException if the calling thread is interrupted
     */
    public Evaluation evaluate(State state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        List<GeneratedSuccessor> successors = new ArrayList<>();
        BitSet enabled = new BitSet(actions.size());
        for (int i = 0; i < actions.size(); i++) {
            Action action = actions.get(i);
            List<Successor> produced = call(action, state);
            if (produced == null) {
                throw new EvaluatorFaultException(action.name(),
                    "Action " + action.name() + " returned a null successor list on " + state);
            }
            for (Successor successor : produced) {
                if (successor == null) {
                    throw new EvaluatorFaultException(action.name(),
                        "Action " + action.name() + " returned a null successor on " + state);
                }
                successors.add(new GeneratedSuccessor(i, action.name(), successor));
            }
            if (!produced.isEmpty()) {
                enabled.set(i);
            }
        }
        return new Evaluation(successors, enabled);
    }

    private List<Successor> call(Action action, State state) {
        if (timeoutExecutor == null) {
            try {
                return action.successors(state);
            } catch (RuntimeException | Error e) {
                if (!EvaluatorFaultException.isFault(e)) {
                    throw e;
                }
                throw fault(action, state, e);
            }
        }

        Future<List<Successor>> future = timeoutExecutor.submit(() -> action.successors(state));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Action {} timed out after {}ms on {}", action.name(), timeoutMs, state);
            throw new EvaluatorTimeoutException(action.name(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error && !EvaluatorFaultException.isFault(error)) {
                throw error;
            }
            throw fault(action, state, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExplorationCancelledException("Interrupted while evaluating " + action.name(), e);
        }
    }

    private static EvaluatorFaultException fault(Action action, State state, Throwable cause) {
        if (cause instanceof EvaluatorFaultException fault) {
            return fault;
        }
        return new EvaluatorFaultException(action.name(),
            "Action " + action.name() + " threw on " + state + ": " + cause, cause);
    }

    @Override
    public void close() {
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "statecheck-evaluator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
