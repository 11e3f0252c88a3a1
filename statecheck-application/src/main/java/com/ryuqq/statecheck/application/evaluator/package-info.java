/**
 * Successor enumeration with fault and timeout bounds.
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.application.evaluator;
