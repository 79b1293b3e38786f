/**
 * Domain model of the terminal recovery engine.
 *
 * <p>Contains the immutable {@link com.phillippitts.tapguard.domain.HealthSnapshot} sampled each
 * cycle, the closed {@link com.phillippitts.tapguard.domain.RecoveryType} classification, the
 * per-class {@link com.phillippitts.tapguard.domain.BackoffPolicy} and the cross-cycle
 * {@link com.phillippitts.tapguard.domain.RecoveryState}.
 *
 * <p>Types here are plain records and enums with no Spring dependencies. Unknown signal
 * values are explicit ({@link com.phillippitts.tapguard.domain.Signal#UNKNOWN} and the
 * {@code UNKNOWN} constants of the state enums) instead of placeholder strings.
 *
 * @since 1.0
 */
package com.phillippitts.tapguard.domain;
