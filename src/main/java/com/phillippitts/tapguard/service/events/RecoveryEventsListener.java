package com.phillippitts.tapguard.service.events;

import com.phillippitts.tapguard.service.recovery.CycleAction;
import com.phillippitts.tapguard.service.recovery.CycleReport;
import com.phillippitts.tapguard.service.recovery.LifecycleOutcome;
import com.phillippitts.tapguard.service.recovery.event.LifecycleActionEvent;
import com.phillippitts.tapguard.service.recovery.event.RecoveryCycleEvent;
import com.phillippitts.tapguard.service.recovery.event.RecoveryMilestoneEvent;
import com.phillippitts.tapguard.service.recovery.event.RecoverySucceededEvent;
import com.phillippitts.tapguard.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Log sink for recovery events. Suppressed-cycle lines are throttled per reason so a long
 * grace window or a firmware update does not flood the log.
 */
@Component
class RecoveryEventsListener {
    private static final Logger LOG = LogManager.getLogger(RecoveryEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    RecoveryEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onCycle(RecoveryCycleEvent e) {
        CycleReport r = e.report();
        if (r.action() == CycleAction.SUPPRESSED) {
            if (shouldLog("suppressed-" + r.skipReason())) {
                LOG.info("Recovery suppressed: reason={}", r.skipReason());
            }
            return;
        }
        LOG.debug("Cycle {} [{}]: classification={}, action={}, attempts={}, elapsed={}, lifecycle={}{}",
                r.cycleId(), r.trigger(), r.classification(), r.action().tag(), r.attemptCount(),
                TimeUtils.describe(r.elapsed()), r.lifecycleAction().tag(),
                r.detail() == null ? "" : ", detail=" + r.detail());
    }

    @EventListener
    void onMilestone(RecoveryMilestoneEvent e) {
        LOG.warn("Still recovering from {}: {} attempts over {}", e.type(), e.attemptCount(),
                TimeUtils.describe(e.elapsed()));
    }

    @EventListener
    void onSucceeded(RecoverySucceededEvent e) {
        LOG.info("Recovery successful: {} cleared after {} attempt(s) in {}", e.type(), e.attemptCount(),
                TimeUtils.describe(e.elapsed()));
    }

    @EventListener
    void onLifecycleAction(LifecycleActionEvent e) {
        if (e.status() == LifecycleOutcome.Status.FAILED) {
            LOG.warn("Transaction {} for {} failed: {}", e.action().tag(), e.paymentIntentId(), e.detail());
        } else {
            LOG.info("Transaction {} for {}: {}{}", e.action().tag(), e.paymentIntentId(), e.status().tag(),
                    e.recreated() ? " (recreated)" : "");
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
