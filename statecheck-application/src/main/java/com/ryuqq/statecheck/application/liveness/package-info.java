/**
 * Liveness analysis under weak and strong fairness.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link com.ryuqq.statecheck.application.liveness.LivenessChecker} reduces a property to an allowed sub-graph</li>
 *   <li>{@link com.ryuqq.statecheck.application.liveness.FairnessTracker} keeps the SCCs that admit a fair cycle</li>
 *   <li>The shallowest reachable one becomes a {@link com.ryuqq.statecheck.application.liveness.LivenessViolation}</li>
 * </ol>
 *
 * <p>Runs only after an exploration that completed without safety violation.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.application.liveness;
