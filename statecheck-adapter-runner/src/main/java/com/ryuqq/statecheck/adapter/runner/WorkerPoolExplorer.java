package com.ryuqq.statecheck.adapter.runner;

import com.ryuqq.statecheck.application.evaluator.ActionEvaluator;
import com.ryuqq.statecheck.application.exploration.ExplorationOutcome;
import com.ryuqq.statecheck.application.exploration.Explorer;
import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.result.ExplorationStatus;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spi.Frontier;
import com.ryuqq.statecheck.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Explorer draining a shared frontier with a fixed pool of workers.
 *
 * <p><strong>Worker loop:</strong></p>
 * <pre>
 * while not halted:
 *   inFlight++ ; id = frontier.poll()
 *   EMPTY      -> inFlight-- ; exit if inFlight == 0 and frontier empty, else yield
 *   otherwise  -> process(id) ; inFlight--
 * </pre>
 *
 * <p>{@code inFlight} is incremented before polling, and a worker offers every successor
 * before it decrements, so a worker never observes "no work in flight and empty
 * frontier" while successors are still to come.</p>
 *
 * <p><strong>Guarantees:</strong> the same set of reachable states and edges as
 * {@link SequentialExplorer}, hence the same distinct-state count and the same verdict
 * for invariants that hold. State ids, the reported violation among several, and trace
 * length are not deterministic.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class WorkerPoolExplorer implements Explorer {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolExplorer.class);

    private final WorkerPoolConfig config;

    public WorkerPoolExplorer() {
        this(new WorkerPoolConfig());
    }

    /**
     * @param config pool settings
     * @throws IllegalArgumentException if config is null
     */
    public WorkerPoolExplorer(WorkerPoolConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public ExplorationOutcome explore(Model model, CheckerConfig checkerConfig, StateStore store, Frontier frontier) {
        if (model == null || checkerConfig == null || store == null || frontier == null) {
            throw new IllegalArgumentException("model, checkerConfig, store and frontier cannot be null");
        }
        try (ActionEvaluator evaluator = new ActionEvaluator(model.getActions(), checkerConfig.evaluatorTimeoutMs())) {
            ExplorationRun run = new ExplorationRun(model, checkerConfig, store, frontier, evaluator);
            run.seed();
            if (run.isHalted()) {
                return run.outcome();
            }

            ExecutorService workers = Executors.newFixedThreadPool(config.workers(), workerThreads());
            AtomicInteger inFlight = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>(config.workers());
            try {
                for (int i = 0; i < config.workers(); i++) {
                    futures.add(workers.submit(() -> drain(run, frontier, inFlight)));
                }
                for (Future<?> future : futures) {
                    future.get();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.fail(ExplorationStatus.CANCELLED, "Interrupted while waiting for workers");
            } catch (ExecutionException e) {
                log.warn("Exploration worker failed", e.getCause());
                run.fail(ExplorationStatus.EVALUATOR_FAULT, "Exploration worker failed: " + e.getCause());
            } finally {
                workers.shutdownNow();
            }
            log.debug("Worker pool finished: {} workers, {} expanded states", config.workers(), run.statesExplored());
            return run.outcome();
        }
    }

    private static void drain(ExplorationRun run, Frontier frontier, AtomicInteger inFlight) {
        while (!run.isHalted()) {
            inFlight.incrementAndGet();
            int stateId = frontier.poll();
            if (stateId == Frontier.EMPTY) {
                inFlight.decrementAndGet();
                if (inFlight.get() == 0 && frontier.isEmpty()) {
                    return;
                }
                Thread.yield();
                continue;
            }
            try {
                run.process(stateId);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "statecheck-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
