package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.DisconnectReason;
import com.phillippitts.tapguard.domain.DisconnectRecord;
import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.domain.Signal;
import com.phillippitts.tapguard.service.recovery.event.SuppressionWindowClosedEvent;
import com.phillippitts.tapguard.testutil.EventCapturingPublisher;
import com.phillippitts.tapguard.testutil.ManualTaskScheduler;
import com.phillippitts.tapguard.testutil.MutableClock;
import com.phillippitts.tapguard.testutil.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.phillippitts.tapguard.testutil.Snapshots.T0;
import static com.phillippitts.tapguard.testutil.Snapshots.healthyManual;
import static org.assertj.core.api.Assertions.assertThat;

class SuppressionGateTest {

    private MutableClock clock;
    private ManualTaskScheduler scheduler;
    private EventCapturingPublisher publisher;
    private SuppressionGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduler = new ManualTaskScheduler();
        publisher = new EventCapturingPublisher();
        gate = new SuppressionGate(TestProperties.recovery().rebootGraceSeconds(120).build(),
                scheduler, publisher, clock);
    }

    @Test
    void healthySnapshotProceeds() {
        SuppressionDecision decision = gate.evaluate(healthyManual(T0).build());

        assertThat(decision.proceed()).isTrue();
        assertThat(decision.reason()).isNull();
    }

    @Test
    void softwareUpdateSuppressesFirst() {
        HealthSnapshot snapshot = healthyManual(T0)
                .softwareUpdateInProgress(Signal.TRUE)
                .inPaymentSession(Signal.FALSE)
                .lastDisconnect(new DisconnectRecord(DisconnectReason.SECURITY_REBOOT, T0))
                .build();

        SuppressionDecision decision = gate.evaluate(snapshot);

        assertThat(decision.proceed()).isFalse();
        assertThat(decision.reason()).isEqualTo(SuppressionDecision.SOFTWARE_UPDATE);
    }

    @Test
    void outsidePaymentSessionSuppresses() {
        SuppressionDecision decision = gate.evaluate(healthyManual(T0).inPaymentSession(Signal.FALSE).build());

        assertThat(decision.proceed()).isFalse();
        assertThat(decision.reason()).isEqualTo(SuppressionDecision.NOT_IN_PAYMENT_SESSION);
    }

    @Test
    void unknownUpdateAndSessionSignalsDoNotBlock() {
        HealthSnapshot snapshot = healthyManual(T0)
                .softwareUpdateInProgress(Signal.UNKNOWN)
                .inPaymentSession(Signal.UNKNOWN)
                .build();

        assertThat(gate.evaluate(snapshot).proceed()).isTrue();
    }

    @Test
    void rebootGraceCoversTheWholeWindowInclusive() {
        DisconnectRecord reboot = new DisconnectRecord(DisconnectReason.SECURITY_REBOOT, T0);

        for (int second = 0; second <= 120; second++) {
            Instant at = T0.plusSeconds(second);
            SuppressionDecision decision = gate.evaluate(healthyManual(at).lastDisconnect(reboot).build());
            assertThat(decision.proceed()).as("t+%ds", second).isFalse();
            assertThat(decision.reason()).isEqualTo(SuppressionDecision.REBOOT_GRACE);
        }
        assertThat(gate.evaluate(healthyManual(T0.plusSeconds(121)).lastDisconnect(reboot).build()).proceed())
                .isTrue();
    }

    @Test
    void otherDisconnectReasonsDoNotSuppress() {
        DisconnectRecord unplugged = new DisconnectRecord(DisconnectReason.USB_DISCONNECTED, T0);

        assertThat(gate.evaluate(healthyManual(T0.plusSeconds(5)).lastDisconnect(unplugged).build()).proceed())
                .isTrue();
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void graceTimerFiresOnceJustAfterTheWindow() {
        DisconnectRecord reboot = new DisconnectRecord(DisconnectReason.SECURITY_REBOOT, T0);

        gate.evaluate(healthyManual(T0.plusSeconds(10)).lastDisconnect(reboot).build());
        gate.evaluate(healthyManual(T0.plusSeconds(40)).lastDisconnect(reboot).build());

        assertThat(scheduler.pendingStartTimes()).containsExactly(T0.plusSeconds(120).plusMillis(1));

        clock.set(T0.plusSeconds(120).plusMillis(1));
        assertThat(scheduler.runDue(clock.instant())).isEqualTo(1);

        assertThat(publisher.eventsOf(SuppressionWindowClosedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.rebootAt()).isEqualTo(T0));
    }

    @Test
    void newRebootMarkerRearmsTimer() {
        gate.evaluate(healthyManual(T0).lastDisconnect(
                new DisconnectRecord(DisconnectReason.SECURITY_REBOOT, T0)).build());

        Instant secondReboot = T0.plusSeconds(60);
        clock.set(secondReboot);
        gate.evaluate(healthyManual(secondReboot).lastDisconnect(
                new DisconnectRecord(DisconnectReason.SECURITY_REBOOT, secondReboot)).build());

        assertThat(scheduler.pendingStartTimes()).containsExactly(secondReboot.plusSeconds(120).plusMillis(1));
    }

    @Test
    void expiredMarkerArmsNoTimer() {
        clock.set(T0.plusSeconds(600));
        gate.evaluate(healthyManual(clock.instant()).lastDisconnect(
                new DisconnectRecord(DisconnectReason.SECURITY_REBOOT, T0)).build());

        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void shutdownCancelsPendingTimer() {
        gate.evaluate(healthyManual(T0).lastDisconnect(
                new DisconnectRecord(DisconnectReason.SECURITY_REBOOT, T0)).build());

        gate.shutdown();

        assertThat(scheduler.pendingCount()).isZero();
    }
}
