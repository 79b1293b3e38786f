/**
 * Event-driven transaction replacement on connectivity flips, outside the polling cycle.
 */
package com.phillippitts.tapguard.service.recovery.fastpath;
