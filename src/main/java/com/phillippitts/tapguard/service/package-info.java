/**
 * Service layer.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.terminal} - boundary to the terminal transport bridge (signals in,
 *       commands out)</li>
 *   <li>{@code service.recovery} - the recovery engine and its events</li>
 *   <li>{@code service.events} - log sink for recovery events</li>
 *   <li>{@code service.metrics} - Micrometer counters</li>
 *   <li>{@code service.health} - actuator health indicator</li>
 * </ul>
 *
 * <p>Services use constructor injection and never throw HTTP exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.tapguard.service;
