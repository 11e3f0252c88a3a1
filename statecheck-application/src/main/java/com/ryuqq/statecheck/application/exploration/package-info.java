/**
 * Exploration port.
 *
 * <p>{@link com.ryuqq.statecheck.application.exploration.Explorer} implementations live
 * in {@code statecheck-adapter-runner}: a deterministic single-threaded BFS and a
 * worker pool draining a shared frontier.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.application.exploration;
