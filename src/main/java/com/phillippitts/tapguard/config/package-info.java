/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.tapguard.config.ThreadPoolConfig} - recovery executor and
 *       task scheduler</li>
 *   <li>{@link com.phillippitts.tapguard.config.ThreadPoolMetricsConfig} - pool gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.recovery} - recovery engine and terminal properties, collaborator wiring</li>
 *   <li>{@code config.properties} - thread pool sizing</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.tapguard.config;
