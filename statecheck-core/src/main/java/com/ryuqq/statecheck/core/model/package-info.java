/**
 * Core value types of the explored state space.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statecheck.core.model.State} - Immutable variable snapshot with canonical form</li>
 *   <li>{@link com.ryuqq.statecheck.core.model.Transition} - Discovery edge (source, action, target)</li>
 *   <li>{@link com.ryuqq.statecheck.core.model.TraceStep} - One step of a counterexample</li>
 *   <li>{@link com.ryuqq.statecheck.core.model.CounterexampleTrace} - Finite path or lasso</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable and safe to share between workers</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.core.model;
