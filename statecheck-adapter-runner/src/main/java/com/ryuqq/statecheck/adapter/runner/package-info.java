/**
 * Runner adapters: exploration strategies and the default model checker.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statecheck.adapter.runner.SequentialExplorer} - deterministic BFS on the calling thread</li>
 *   <li>{@link com.ryuqq.statecheck.adapter.runner.WorkerPoolExplorer} - fixed thread pool over a shared frontier</li>
 *   <li>{@link com.ryuqq.statecheck.adapter.runner.DefaultModelChecker} - exploration, liveness and traces behind {@code run(config)}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ModelChecker checker = new DefaultModelChecker(model, new WorkerPoolExplorer(new WorkerPoolConfig(8)));
 * ExplorationResult result = checker.run(new CheckerConfig());
 * </pre>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.adapter.runner;
