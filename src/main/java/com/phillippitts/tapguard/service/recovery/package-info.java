/**
 * The recovery engine.
 *
 * <p>Per cycle, driven by {@link com.phillippitts.tapguard.service.recovery.RecoveryCycleRunner}:
 * <ol>
 *   <li>{@link com.phillippitts.tapguard.service.recovery.HealthSampler} takes a snapshot</li>
 *   <li>{@link com.phillippitts.tapguard.service.recovery.SuppressionGate} may skip the cycle</li>
 *   <li>{@link com.phillippitts.tapguard.service.recovery.PaymentIntentLifecycleGuard} replaces
 *       stale transactions</li>
 *   <li>{@link com.phillippitts.tapguard.service.recovery.ConditionEvaluator} classifies</li>
 *   <li>{@link com.phillippitts.tapguard.service.recovery.RecoveryScheduler} applies backoff</li>
 *   <li>{@link com.phillippitts.tapguard.service.recovery.RecoveryExecutor} remediates</li>
 * </ol>
 *
 * <p>Transaction cancel/recreate from any source goes through
 * {@link com.phillippitts.tapguard.service.recovery.TransactionCoordinator}.
 */
package com.phillippitts.tapguard.service.recovery;
