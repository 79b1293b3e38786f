/**
 * Logging infrastructure: request-scoped MDC values for Log4j 2.
 */
package com.phillippitts.tapguard.config.logging;
