/**
 * Sample models with known verdicts.
 *
 * @since 1.0.0
 * @author Statecheck Team
 */
package com.ryuqq.statecheck.testkit.model;
