package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.config.logging.ThreadContextTaskDecorator;
import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.domain.DisconnectRecord;
import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.service.recovery.event.SuppressionWindowClosedEvent;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Decides whether recovery may run for a snapshot.
 *
 * <p>Checks in order: software update in progress, reboot grace window, payment session.
 * Unknown update and session signals do not block; they carry no evidence that recovery
 * would interfere.
 *
 * <p>The reboot grace window covers {@code [T0, T0 + grace]} inclusive, where T0 is the time
 * of the last reboot-class disconnect. When a new reboot marker is first seen, a one-shot
 * timer is armed for the end of the window; on expiry it publishes
 * {@link SuppressionWindowClosedEvent} so a cycle can run without waiting for the next poll.
 */
@Component
public class SuppressionGate {

    private static final Logger LOG = LogManager.getLogger(SuppressionGate.class);

    private final Duration grace;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Object timerLock = new Object();
    private Instant trackedRebootAt;
    private ScheduledFuture<?> graceTimer;

    public SuppressionGate(RecoveryProperties props,
                           TaskScheduler scheduler,
                           ApplicationEventPublisher publisher,
                           Clock clock) {
        this.grace = Objects.requireNonNull(props, "props").getSecurityRebootGrace();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SuppressionDecision evaluate(HealthSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.softwareUpdateInProgress().isTrue()) {
            return SuppressionDecision.skip(SuppressionDecision.SOFTWARE_UPDATE);
        }
        DisconnectRecord reboot = snapshot.lastDisconnectRecord()
                .filter(DisconnectRecord::isRebootMarker)
                .orElse(null);
        if (reboot != null) {
            armTimer(reboot.at());
            if (withinGrace(reboot.at(), snapshot.sampledAt())) {
                return SuppressionDecision.skip(SuppressionDecision.REBOOT_GRACE);
            }
        }
        if (snapshot.inPaymentSession().isFalse()) {
            return SuppressionDecision.skip(SuppressionDecision.NOT_IN_PAYMENT_SESSION);
        }
        return SuppressionDecision.proceedWith();
    }

    boolean withinGrace(Instant rebootAt, Instant now) {
        return !now.isAfter(windowEnd(rebootAt));
    }

    Instant windowEnd(Instant rebootAt) {
        return rebootAt.plus(grace);
    }

    private void armTimer(Instant rebootAt) {
        synchronized (timerLock) {
            if (rebootAt.equals(trackedRebootAt)) {
                return;
            }
            trackedRebootAt = rebootAt;
            cancelTimer();
            Instant fireAt = windowEnd(rebootAt).plusMillis(1);
            if (!fireAt.isAfter(clock.instant())) {
                return;
            }
            LOG.info("Reboot-class disconnect at {}; recovery suppressed until {}", rebootAt, windowEnd(rebootAt));
            graceTimer = scheduler.schedule(
                    ThreadContextTaskDecorator.propagating(() -> onWindowClosed(rebootAt)), fireAt);
        }
    }

    private void onWindowClosed(Instant rebootAt) {
        LOG.info("Reboot grace window closed (disconnect at {})", rebootAt);
        publisher.publishEvent(new SuppressionWindowClosedEvent(rebootAt, clock.instant()));
    }

    private void cancelTimer() {
        if (graceTimer != null) {
            graceTimer.cancel(false);
            graceTimer = null;
        }
    }

    @PreDestroy
    void shutdown() {
        synchronized (timerLock) {
            cancelTimer();
        }
    }
}
