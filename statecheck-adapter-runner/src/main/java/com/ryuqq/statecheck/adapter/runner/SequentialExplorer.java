package com.ryuqq.statecheck.adapter.runner;

import com.ryuqq.statecheck.application.evaluator.ActionEvaluator;
import com.ryuqq.statecheck.application.exploration.ExplorationOutcome;
import com.ryuqq.statecheck.application.exploration.Explorer;
import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spi.Frontier;
import com.ryuqq.statecheck.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic single-threaded breadth-first explorer.
 *
 * <p>States are expanded in the order they were discovered, so:</p>
 * <ul>
 *   <li>state ids, counters and traces are identical across runs of the same model</li>
 *   <li>the first safety violation found lies at minimal depth, and its trace is a shortest counterexample</li>
 * </ul>
 *
 * <p>Stateless: one instance can serve any number of runs, also concurrently.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class SequentialExplorer implements Explorer {

    private static final Logger log = LoggerFactory.getLogger(SequentialExplorer.class);

    @Override
    public ExplorationOutcome explore(Model model, CheckerConfig config, StateStore store, Frontier frontier) {
        if (model == null || config == null || store == null || frontier == null) {
            throw new IllegalArgumentException("model, config, store and frontier cannot be null");
        }
        try (ActionEvaluator evaluator = new ActionEvaluator(model.getActions(), config.evaluatorTimeoutMs())) {
            ExplorationRun run = new ExplorationRun(model, config, store, frontier, evaluator);
            run.seed();

            int level = 0;
            while (!run.isHalted()) {
                int stateId = frontier.poll();
                if (stateId == Frontier.EMPTY) {
                    break;
                }
                int depth = run.graph().depthOf(stateId);
                if (depth > level) {
                    level = depth;
                    log.debug("BFS level {}: {} distinct states, {} queued", level, store.size(), frontier.size());
                }
                run.process(stateId);
            }
            return run.outcome();
        }
    }
}
