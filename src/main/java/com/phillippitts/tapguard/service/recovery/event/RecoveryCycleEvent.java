package com.phillippitts.tapguard.service.recovery.event;

import com.phillippitts.tapguard.service.recovery.CycleReport;

/**
 * Published once per completed recovery cycle, suppressed cycles included.
 */
public record RecoveryCycleEvent(CycleReport report) {
}
