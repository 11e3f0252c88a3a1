/**
 * Counterexample reconstruction from parent pointers and recorded edges.
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.application.trace;
