/**
 * Run results exposed to report renderers and CLIs.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statecheck.core.result.ExplorationStatus} - Success, violation or run-level failure</li>
 *   <li>{@link com.ryuqq.statecheck.core.result.ExplorationResult} - Status, counters, violated name and trace</li>
 * </ul>
 *
 * <p>No wire or file format is defined; rendering is the caller's responsibility.</p>
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.core.result;
