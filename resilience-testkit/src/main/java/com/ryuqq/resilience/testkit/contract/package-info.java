/**
 * Contract test infrastructure for policy stacks.
 *
 * <p>Deterministic doubles for time ({@link com.ryuqq.resilience.testkit.contract.MutableClock}),
 * waiting ({@link com.ryuqq.resilience.testkit.contract.RecordingSleeper}) and the downstream call
 * ({@link com.ryuqq.resilience.testkit.contract.ScriptedInvoker}).</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.contract;
